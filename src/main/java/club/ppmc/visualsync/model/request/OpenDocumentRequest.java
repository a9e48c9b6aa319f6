/**
 * OpenDocumentRequest.java
 *
 * 打开 (或切换到) 工作区中的一个源文件。
 */
package club.ppmc.visualsync.model.request;

import jakarta.validation.constraints.NotBlank;

public record OpenDocumentRequest(@NotBlank String projectPath, @NotBlank String path) {}
