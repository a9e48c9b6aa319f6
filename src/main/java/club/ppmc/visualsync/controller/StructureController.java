/**
 * StructureController.java
 *
 * 无会话的结构分析端点：解析一段文本或工作区中的文件，返回构造体树。
 */
package club.ppmc.visualsync.controller;

import club.ppmc.visualsync.model.request.ParseSourceRequest;
import club.ppmc.visualsync.model.tree.RootNode;
import club.ppmc.visualsync.service.SourceStructureService;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/structure")
@Slf4j
public class StructureController {

    private final SourceStructureService structureService;

    public StructureController(SourceStructureService structureService) {
        this.structureService = structureService;
    }

    /**
     * 解析源码。解析错误不会导致请求失败，而是体现在返回的根节点的 diagnostic 字段中。
     */
    @PostMapping("/parse")
    public ResponseEntity<?> parse(@RequestBody ParseSourceRequest request) {
        if (request.hasText()) {
            RootNode root = structureService.parseText(request.text(), request.path());
            return ResponseEntity.ok(root);
        }
        if (request.projectPath() == null || request.path() == null) {
            return ResponseEntity.badRequest()
                    .body(Map.of("message", "请求体中必须包含 'text'，或同时包含 'projectPath' 和 'path'。"));
        }
        try {
            return ResponseEntity.ok(structureService.parseFile(request.projectPath(), request.path()));
        } catch (IOException e) {
            log.warn("解析文件失败: project='{}', path='{}'. 原因: {}", request.projectPath(), request.path(), e.getMessage());
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }

    /**
     * 查找某一行上的构造体：优先返回从该行开始的节点，否则返回包含该行的最内层节点。
     */
    @GetMapping("/node-at-line")
    public ResponseEntity<?> nodeAtLine(
            @RequestParam String projectPath, @RequestParam String path, @RequestParam int line) {
        try {
            return structureService.nodeAtLine(projectPath, path, line)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.noContent().build());
        } catch (IOException e) {
            log.warn("读取文件失败: project='{}', path='{}'. 原因: {}", projectPath, path, e.getMessage());
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }
}
