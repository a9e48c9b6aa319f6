/**
 * UpdateAttributeRequest.java
 *
 * 属性面板对选中节点的一次属性修改。
 * value 可以是字符串、数字、布尔、列表或映射 (如 {"all": 8})，由 ValueSerializer 转换为源码。
 */
package club.ppmc.visualsync.model.request;

import jakarta.validation.constraints.NotBlank;

public record UpdateAttributeRequest(@NotBlank String name, Object value) {}
