/**
 * SyncController.java
 *
 * 同步会话的 HTTP 入口。
 * 每个端点把请求转交给 DocumentSessionService，返回命令结果 (APPLIED / NO_OP / DROPPED) 和最新的会话状态；
 * 树、选区、代码的增量变化另外通过 WebSocket 推送。
 */
package club.ppmc.visualsync.controller;

import club.ppmc.visualsync.exception.DocumentNotOpenException;
import club.ppmc.visualsync.model.CommandOutcome;
import club.ppmc.visualsync.model.SyncSnapshot;
import club.ppmc.visualsync.model.request.CodeUpdateRequest;
import club.ppmc.visualsync.model.request.DeleteNodeRequest;
import club.ppmc.visualsync.model.request.InsertNodeRequest;
import club.ppmc.visualsync.model.request.OpenDocumentRequest;
import club.ppmc.visualsync.model.request.ReorderNodesRequest;
import club.ppmc.visualsync.model.request.SelectLineRequest;
import club.ppmc.visualsync.model.request.SelectNodeRequest;
import club.ppmc.visualsync.model.request.UpdateAttributeRequest;
import club.ppmc.visualsync.model.request.WrapNodeRequest;
import club.ppmc.visualsync.service.DocumentSessionService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sync")
@Slf4j
public class SyncController {

    private final DocumentSessionService sessionService;

    public SyncController(DocumentSessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * 打开 (或切换到) 一个源文件，返回初始的构造体树。
     */
    @PostMapping("/open")
    public ResponseEntity<?> open(@Valid @RequestBody OpenDocumentRequest request) {
        try {
            return ResponseEntity.ok(sessionService.openDocument(request.projectPath(), request.path()));
        } catch (IOException e) {
            log.warn("打开文档失败: project='{}', path='{}'. 原因: {}", request.projectPath(), request.path(), e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("message", "打开文档失败: " + e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }

    @GetMapping("/state")
    public ResponseEntity<SyncSnapshot> state() {
        return ResponseEntity.ok(sessionService.snapshot());
    }

    @PostMapping("/save")
    public ResponseEntity<?> save() {
        try {
            return ResponseEntity.ok(sessionService.saveDocument());
        } catch (DocumentNotOpenException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.toErrorData());
        } catch (IOException e) {
            log.error("保存文档失败", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("message", "保存文档失败: " + e.getMessage()));
        }
    }

    @PostMapping("/select")
    public ResponseEntity<?> select(@Valid @RequestBody SelectNodeRequest request) {
        return run(() -> sessionService.selectNode(request));
    }

    /**
     * 代码编辑器光标移动。
     */
    @PostMapping("/select-line")
    public ResponseEntity<?> selectLine(@Valid @RequestBody SelectLineRequest request) {
        return run(() -> sessionService.selectNodeAtLine(request.line()));
    }

    @DeleteMapping("/select")
    public ResponseEntity<?> clearSelection() {
        return run(sessionService::clearSelection);
    }

    @PostMapping("/attribute")
    public ResponseEntity<?> updateAttribute(@Valid @RequestBody UpdateAttributeRequest request) {
        return run(() -> sessionService.updateAttribute(request.name(), request.value()));
    }

    /**
     * 代码编辑器提交的完整文本；与当前缓冲区相同的文本会被当作回声忽略。
     */
    @PostMapping("/code")
    public ResponseEntity<?> updateCode(@Valid @RequestBody CodeUpdateRequest request) {
        return run(() -> sessionService.applyCode(request.text()));
    }

    @PostMapping("/insert")
    public ResponseEntity<?> insert(@Valid @RequestBody InsertNodeRequest request) {
        return run(() -> sessionService.insertNode(request));
    }

    @PostMapping("/delete")
    public ResponseEntity<?> delete(@Valid @RequestBody(required = false) DeleteNodeRequest request) {
        return run(() -> sessionService.deleteNode(request == null ? null : request.target()));
    }

    @PostMapping("/wrap")
    public ResponseEntity<?> wrap(@Valid @RequestBody WrapNodeRequest request) {
        return run(() -> sessionService.wrapNode(request));
    }

    @PostMapping("/reorder")
    public ResponseEntity<?> reorder(@Valid @RequestBody ReorderNodesRequest request) {
        return run(() -> sessionService.reorderNodes(request));
    }

    @PostMapping("/undo")
    public ResponseEntity<?> undo() {
        return run(sessionService::undo);
    }

    @PostMapping("/redo")
    public ResponseEntity<?> redo() {
        return run(sessionService::redo);
    }

    private ResponseEntity<?> run(Supplier<CommandOutcome> command) {
        try {
            CommandOutcome outcome = command.get();
            return ResponseEntity.ok(Map.of("outcome", outcome, "state", sessionService.snapshot()));
        } catch (DocumentNotOpenException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.toErrorData());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }
}
