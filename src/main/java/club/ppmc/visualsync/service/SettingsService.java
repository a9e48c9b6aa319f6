/**
 * SettingsService.java
 *
 * 应用的配置中心，负责加载、更新和持久化 Settings。
 * 配置以 JSON 格式保存在工作区的隐藏目录 (.ide) 中；首次启动时使用 application.properties 中的值作为默认设置。
 * 其他需要配置的服务都依赖此服务，而不是直接使用 @Value 注解。
 */
package club.ppmc.visualsync.service;

import club.ppmc.visualsync.model.Settings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    private static final String SETTINGS_DIR = ".ide";
    private static final String SETTINGS_FILE_NAME = "settings.json";

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private volatile Settings currentSettings;

    // --- 用于首次初始化的默认值 ---
    private final String initialWorkspaceRoot;
    private final String initialFormatterCommand;
    private final int initialFormatterTimeoutSeconds;
    private final long initialRawEditDebounceMillis;
    private final long initialAttributeDebounceMillis;
    private final int initialHistoryLimit;

    public SettingsService(
            @Value("${app.workspace-root:./workspace}") String initialWorkspaceRoot,
            @Value("${app.formatter.command:}") String initialFormatterCommand,
            @Value("${app.formatter.timeout-seconds:10}") int initialFormatterTimeoutSeconds,
            @Value("${app.sync.raw-edit-debounce-ms:300}") long initialRawEditDebounceMillis,
            @Value("${app.sync.attribute-debounce-ms:500}") long initialAttributeDebounceMillis,
            @Value("${app.sync.history-limit:100}") int initialHistoryLimit) {

        this.initialWorkspaceRoot = initialWorkspaceRoot;
        this.initialFormatterCommand = initialFormatterCommand;
        this.initialFormatterTimeoutSeconds = initialFormatterTimeoutSeconds;
        this.initialRawEditDebounceMillis = initialRawEditDebounceMillis;
        this.initialAttributeDebounceMillis = initialAttributeDebounceMillis;
        this.initialHistoryLimit = initialHistoryLimit;

        // 启动时只知道初始工作区路径，设置文件就放在它下面
        this.settingsFilePath =
                Paths.get(initialWorkspaceRoot, SETTINGS_DIR, SETTINGS_FILE_NAME)
                        .toAbsolutePath()
                        .normalize();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @PostConstruct
    public void init() {
        try {
            Path settingsDir = this.settingsFilePath.getParent();
            if (Files.notExists(settingsDir)) {
                Files.createDirectories(settingsDir);
            }
            if (Files.exists(this.settingsFilePath)) {
                loadSettings();
            } else {
                createAndSaveDefaultSettings();
            }
        } catch (IOException e) {
            LOGGER.error("初始化设置失败。将使用临时的默认设置。", e);
            this.currentSettings = createDefaultSettings();
        }
    }

    public synchronized Settings getSettings() {
        return this.currentSettings;
    }

    public synchronized void updateSettings(Settings newSettings) throws IOException {
        if (newSettings.getHistoryLimit() < 1) {
            throw new IllegalArgumentException("historyLimit 必须大于 0: " + newSettings.getHistoryLimit());
        }
        if (newSettings.getFormatterCommand() == null) {
            newSettings.setFormatterCommand(new ArrayList<>());
        }
        this.currentSettings = newSettings;
        saveSettings();
    }

    private void loadSettings() throws IOException {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            this.currentSettings = objectMapper.readValue(jsonData, Settings.class);
            LOGGER.info("已成功从 {} 加载设置。", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。下次保存时将创建新的默认文件。", e);
            this.currentSettings = createDefaultSettings();
            throw e;
        }
    }

    private void saveSettings() throws IOException {
        // 工作区路径可能已被修改，按最新值确定保存位置
        Path currentSettingsPath =
                Paths.get(currentSettings.getWorkspaceRoot(), SETTINGS_DIR, SETTINGS_FILE_NAME)
                        .toAbsolutePath()
                        .normalize();
        if (Files.notExists(currentSettingsPath.getParent())) {
            Files.createDirectories(currentSettingsPath.getParent());
        }

        try {
            byte[] jsonData = objectMapper.writeValueAsBytes(currentSettings);
            Files.write(currentSettingsPath, jsonData);
            LOGGER.info("已成功将设置保存到 {}", currentSettingsPath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", currentSettingsPath, e);
            throw e;
        }
    }

    private void createAndSaveDefaultSettings() throws IOException {
        this.currentSettings = createDefaultSettings();
        saveSettings();
        LOGGER.info("未找到设置文件。已在 {} 创建了包含默认值的新文件。", settingsFilePath);
    }

    private Settings createDefaultSettings() {
        var settings = new Settings();
        settings.setWorkspaceRoot(this.initialWorkspaceRoot);
        settings.setFormatterCommand(parseCommand(this.initialFormatterCommand));
        settings.setFormatterTimeoutSeconds(this.initialFormatterTimeoutSeconds);
        settings.setRawEditDebounceMillis(this.initialRawEditDebounceMillis);
        settings.setAttributeDebounceMillis(this.initialAttributeDebounceMillis);
        settings.setHistoryLimit(this.initialHistoryLimit);
        return settings;
    }

    /** 逗号分隔的命令行，例如 "dart,format,--output=show"。 */
    static List<String> parseCommand(String commandLine) {
        if (!StringUtils.hasText(commandLine)) {
            return new ArrayList<>();
        }
        return new ArrayList<>(
                Arrays.stream(commandLine.split(","))
                        .map(String::trim)
                        .filter(StringUtils::hasText)
                        .toList());
    }
}
