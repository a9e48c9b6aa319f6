/**
 * CodeUpdateRequest.java
 *
 * 代码编辑器提交的完整文本。
 */
package club.ppmc.visualsync.model.request;

import jakarta.validation.constraints.NotNull;

public record CodeUpdateRequest(@NotNull String text) {}
