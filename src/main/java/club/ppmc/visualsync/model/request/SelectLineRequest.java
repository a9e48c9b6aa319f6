/**
 * SelectLineRequest.java
 *
 * 代码编辑器光标所在的行 (从 1 开始)。
 */
package club.ppmc.visualsync.model.request;

import jakarta.validation.constraints.Positive;

public record SelectLineRequest(@Positive int line) {}
