/**
 * FileController.java
 *
 * 读写工作区文件内容的 HTTP 端点。
 * 用于在同步会话之外直接查看或覆盖源文件；已打开文档的保存请走 /api/sync/save。
 */
package club.ppmc.visualsync.controller;

import club.ppmc.visualsync.model.FileContentRequest;
import club.ppmc.visualsync.service.FileService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/files")
@Slf4j
public class FileController {

    private final FileService fileService;

    public FileController(FileService fileService) {
        this.fileService = fileService;
    }

    @GetMapping("/content")
    public ResponseEntity<String> getFileContent(
            @RequestParam String projectPath, @RequestParam String path) {
        try {
            String content = fileService.readFileContent(projectPath, path);
            return ResponseEntity.ok()
                    .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                    .body(content);
        } catch (IOException e) {
            log.warn("读取文件内容失败: project='{}', path='{}'. 原因: {}", projectPath, path, e.getMessage());
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            log.warn("读取文件时路径无效: project='{}', path='{}'", projectPath, path);
            return ResponseEntity.badRequest().build();
        }
    }

    @PostMapping("/content")
    public ResponseEntity<Map<String, String>> saveFileContent(@Valid @RequestBody FileContentRequest request) {
        try {
            fileService.writeFileContent(request.projectPath(), request.path(), request.content());
            return ResponseEntity.ok(Map.of("message", "文件保存成功。"));
        } catch (IOException e) {
            log.error("保存文件 '{}' 到项目 '{}' 失败", request.path(), request.projectPath(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("message", "保存文件失败: " + e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }
}
