/**
 * SettingsController.java
 *
 * 读取和更新后端设置 (工作区、格式化器、防抖间隔、历史长度)。
 * 防抖与历史长度由编排器在打开文档时读取，因此修改只对之后打开的文档生效。
 */
package club.ppmc.visualsync.controller;

import club.ppmc.visualsync.model.Settings;
import club.ppmc.visualsync.service.DocumentSessionService;
import club.ppmc.visualsync.service.SettingsService;
import club.ppmc.visualsync.service.SourceFormattingService;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
@Slf4j
public class SettingsController {

    private final SettingsService settingsService;
    private final SourceFormattingService formattingService;
    private final DocumentSessionService sessionService;

    public SettingsController(
            SettingsService settingsService,
            SourceFormattingService formattingService,
            DocumentSessionService sessionService) {
        this.settingsService = settingsService;
        this.formattingService = formattingService;
        this.sessionService = sessionService;
    }

    @GetMapping
    public ResponseEntity<Settings> getSettings() {
        return ResponseEntity.ok(settingsService.getSettings());
    }

    /** 结构化编辑之后是否会调用外部格式化器，以及使用的命令。 */
    @GetMapping("/formatter")
    public ResponseEntity<Map<String, Object>> formatterStatus() {
        Settings settings = settingsService.getSettings();
        return ResponseEntity.ok(Map.of(
                "enabled", formattingService.isEnabled(),
                "command", settings.getFormatterCommand(),
                "timeoutSeconds", settings.getFormatterTimeoutSeconds()));
    }

    @PostMapping
    public ResponseEntity<?> updateSettings(@RequestBody Settings newSettings) {
        try {
            settingsService.updateSettings(newSettings);
            boolean deferred = sessionService.isDocumentOpen();
            if (deferred) {
                log.info("同步参数已更新，将在下一次打开文档时生效");
            }
            return ResponseEntity.ok(Map.of(
                    "message", deferred ? "设置已保存，同步参数将在重新打开文档后生效。" : "设置更新成功。",
                    "appliesOnNextOpen", deferred));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        } catch (IOException e) {
            log.error("保存设置失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "保存设置失败: " + e.getMessage()));
        }
    }
}
