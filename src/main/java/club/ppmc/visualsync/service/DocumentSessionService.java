/**
 * DocumentSessionService.java
 *
 * 持有当前打开的文档及其 SyncOrchestrator，是 REST 层与同步引擎之间的桥梁。
 *
 * 线程模型:
 * 编排器不是线程安全的。本服务拥有一个单线程的 ScheduledExecutorService 作为唯一消费者：
 * 每个 HTTP 请求都把命令提交到该线程并等待结果，编排器的防抖解析任务也调度在同一个线程上，
 * 因此所有状态变更天然串行，不需要任何锁。
 */
package club.ppmc.visualsync.service;

import club.ppmc.visualsync.engine.parser.ConstructTreeParser;
import club.ppmc.visualsync.engine.parser.TreeAssembler;
import club.ppmc.visualsync.engine.sync.SyncOptions;
import club.ppmc.visualsync.engine.sync.SyncOrchestrator;
import club.ppmc.visualsync.exception.DocumentNotOpenException;
import club.ppmc.visualsync.model.CommandOutcome;
import club.ppmc.visualsync.model.NodeRef;
import club.ppmc.visualsync.model.Settings;
import club.ppmc.visualsync.model.SourceBuffer;
import club.ppmc.visualsync.model.SyncSnapshot;
import club.ppmc.visualsync.model.SyncState;
import club.ppmc.visualsync.model.request.InsertNodeRequest;
import club.ppmc.visualsync.model.request.ReorderNodesRequest;
import club.ppmc.visualsync.model.request.SelectNodeRequest;
import club.ppmc.visualsync.model.request.WrapNodeRequest;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DocumentSessionService {

    private final SettingsService settingsService;
    private final FileService fileService;
    private final SourceFormattingService formattingService;
    private final SyncNotificationService notificationService;
    private final ScheduledExecutorService executor;

    // 以下字段只在 executor 线程上写入
    private volatile SyncOrchestrator orchestrator;
    private volatile String projectPath;
    private volatile String relativePath;

    public DocumentSessionService(
            SettingsService settingsService,
            FileService fileService,
            SourceFormattingService formattingService,
            SyncNotificationService notificationService) {
        this.settingsService = settingsService;
        this.fileService = fileService;
        this.formattingService = formattingService;
        this.notificationService = notificationService;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sync-orchestrator");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 打开 (或切换到) 工作区中的文件。切换文件会丢弃上一个文档的选区、历史和未保存的修改。
     *
     * @throws IOException 如果文件无法读取。
     */
    public SyncSnapshot openDocument(String projectPath, String path) throws IOException {
        String text = fileService.readFileContent(projectPath, path);
        String displayPath = fileService.displayPath(projectPath, path);
        return execute(() -> {
            if (orchestrator != null) {
                orchestrator.close();
            }
            var created = new SyncOrchestrator(formattingService, executor, currentOptions());
            created.addListener(notificationService);
            this.orchestrator = created;
            this.projectPath = projectPath;
            this.relativePath = path;
            created.open(SourceBuffer.open(displayPath, text));
            return snapshotOf(created);
        });
    }

    /**
     * 先让待执行的解析落地，再把缓冲区写回磁盘。写入失败时缓冲区保持原样 (仍为脏)。
     *
     * @throws IOException 如果写入失败。
     */
    public SyncSnapshot saveDocument() throws IOException {
        SourceBuffer buffer = command("saveDocument", sync -> {
            sync.flushPendingReparse();
            return sync.getBuffer();
        });
        fileService.writeFileContent(projectPath, relativePath, buffer.text());
        log.info("已保存文档 {}", buffer.path());
        return command("saveDocument", sync -> {
            // 保存期间可能有新的编辑进入，只有文本未变时才清除脏标记
            if (sync.getBuffer().text().equals(buffer.text())) {
                sync.markSaved();
            }
            return snapshotOf(sync);
        });
    }

    public SyncSnapshot snapshot() {
        if (orchestrator == null) {
            return new SyncSnapshot(
                    null, TreeAssembler.emptyRoot("", null), null, SyncState.IDLE, false, false, false);
        }
        return command("snapshot", DocumentSessionService::snapshotOf);
    }

    public boolean isDocumentOpen() {
        return orchestrator != null;
    }

    // ---------------------------------------------------------------
    // 转发给编排器的命令
    // ---------------------------------------------------------------

    public CommandOutcome selectNode(SelectNodeRequest request) {
        return command("selectNode", sync ->
                sync.selectNode(request.node(), request.columnOrDefault(), request.sourceOrDefault()));
    }

    public CommandOutcome selectNodeAtLine(int line) {
        return command("selectNodeAtLine", sync -> sync.selectNodeAtLine(line));
    }

    public CommandOutcome clearSelection() {
        return command("clearSelection", sync -> {
            sync.clearSelection();
            return CommandOutcome.APPLIED;
        });
    }

    public CommandOutcome updateAttribute(String name, Object value) {
        return command("updateAttribute", sync -> sync.updateAttribute(name, value));
    }

    public CommandOutcome applyCode(String text) {
        return command("applyRawEdit", sync -> sync.applyRawEdit(text));
    }

    public CommandOutcome insertNode(InsertNodeRequest request) {
        return command("insertNode", sync -> request.anchor() == null
                ? sync.insertNode(request.snippet(), request.position())
                : sync.insertNode(request.anchor(), request.snippet(), request.position()));
    }

    public CommandOutcome deleteNode(NodeRef target) {
        return command("deleteNode", sync -> target == null ? sync.deleteNode() : sync.deleteNode(target));
    }

    public CommandOutcome wrapNode(WrapNodeRequest request) {
        return command("wrapNode", sync -> request.target() == null
                ? sync.wrapNode(request.wrapperName(), request.attributesOrEmpty())
                : sync.wrapNode(request.target(), request.wrapperName(), request.attributesOrEmpty()));
    }

    public CommandOutcome reorderNodes(ReorderNodesRequest request) {
        return command("reorderNodes", sync -> sync.reorderNodes(
                request.first(), request.firstColumn(), request.second(), request.secondColumn()));
    }

    public CommandOutcome undo() {
        return command("undo", SyncOrchestrator::undo);
    }

    public CommandOutcome redo() {
        return command("redo", SyncOrchestrator::redo);
    }

    @PreDestroy
    public void shutdown() {
        log.info("关闭同步会话线程");
        executor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // 辅助方法
    // ---------------------------------------------------------------

    private <T> T command(String operation, Function<SyncOrchestrator, T> action) {
        if (orchestrator == null) {
            throw new DocumentNotOpenException(operation);
        }
        return execute(() -> {
            SyncOrchestrator current = orchestrator;
            if (current == null) {
                throw new DocumentNotOpenException(operation);
            }
            return action.apply(current);
        });
    }

    private <T> T execute(Callable<T> task) {
        try {
            return executor.submit(task).get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("同步命令执行失败: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("等待同步命令时线程被中断", e);
        }
    }

    private SyncOptions currentOptions() {
        Settings settings = settingsService.getSettings();
        return new SyncOptions(
                Duration.ofMillis(settings.getRawEditDebounceMillis()),
                Duration.ofMillis(settings.getAttributeDebounceMillis()),
                Math.max(1, settings.getHistoryLimit()),
                ConstructTreeParser.DEFAULT_SNIPPET_MAX_LENGTH);
    }

    private static SyncSnapshot snapshotOf(SyncOrchestrator sync) {
        return new SyncSnapshot(
                sync.getBuffer(),
                sync.getTree(),
                sync.getSelection(),
                sync.getState(),
                sync.canUndo(),
                sync.canRedo(),
                sync.hasPendingReparse());
    }
}
