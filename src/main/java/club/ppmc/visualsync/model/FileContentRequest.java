/**
 * FileContentRequest.java
 *
 * 保存文件内容的请求体，由 FileController 使用。
 *
 * @param projectPath 目标文件所属的项目名称。
 * @param path 文件相对于项目根目录的路径。
 * @param content 要写入的新内容。
 */
package club.ppmc.visualsync.model;

import jakarta.validation.constraints.NotBlank;

public record FileContentRequest(
        @NotBlank String projectPath, @NotBlank String path, String content) {}
