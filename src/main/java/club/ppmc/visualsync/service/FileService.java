/**
 * FileService.java
 *
 * 负责读写工作区中的源文件。
 * 它依赖 SettingsService 动态获取工作区根目录，并对每个路径做路径遍历检查，
 * 确保所有操作都落在工作区内部。
 */
package club.ppmc.visualsync.service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class FileService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileService.class);

    private final SettingsService settingsService;

    public FileService(SettingsService settingsService) {
        this.settingsService = settingsService;
        try {
            getWorkspaceRoot();
        } catch (RuntimeException e) {
            LOGGER.error("无法在服务初始化时创建工作区目录。", e);
        }
    }

    /**
     * 实时从 SettingsService 获取工作区根目录，不存在时创建它。
     *
     * @throws RuntimeException 如果无法创建工作区目录。
     */
    Path getWorkspaceRoot() {
        String workspaceRootPath = settingsService.getSettings().getWorkspaceRoot();
        if (!StringUtils.hasText(workspaceRootPath)) {
            workspaceRootPath = "./workspace";
        }
        var resolvedPath = Paths.get(workspaceRootPath).toAbsolutePath().normalize();

        if (Files.notExists(resolvedPath)) {
            try {
                Files.createDirectories(resolvedPath);
                LOGGER.info("工作区根目录不存在，已创建: {}", resolvedPath);
            } catch (IOException e) {
                LOGGER.error("致命错误: 无法在以下路径创建工作区根目录: {}", resolvedPath, e);
                throw new RuntimeException("无法创建工作区目录: " + resolvedPath, e);
            }
        }
        return resolvedPath;
    }

    public String readFileContent(String projectPath, String relativePathInProject) throws IOException {
        File file = getValidatedAbsolutePath(projectPath, relativePathInProject).toFile();
        if (!file.exists()) {
            throw new IOException("文件未找到: " + relativePathInProject);
        }
        if (file.isDirectory()) {
            throw new IOException("无法读取目录的内容: " + relativePathInProject);
        }
        return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    }

    public void writeFileContent(String projectPath, String relativePathInProject, String content)
            throws IOException {
        File file = getValidatedAbsolutePath(projectPath, relativePathInProject).toFile();
        if (file.isDirectory()) {
            throw new IOException("无法写入目录: " + relativePathInProject);
        }
        // writeStringToFile 会自动创建缺失的父目录
        FileUtils.writeStringToFile(file, content == null ? "" : content, StandardCharsets.UTF_8);
        LOGGER.debug("已写入文件 {} ({} 个字符)", file, content == null ? 0 : content.length());
    }

    /**
     * 统一的展示路径：项目名 + 相对路径，使用 Unix 风格分隔符。
     */
    public String displayPath(String projectPath, String relativePathInProject) {
        return (projectPath + "/" + relativePathInProject).replace(File.separator, "/");
    }

    private Path getValidatedAbsolutePath(String projectPath, String relativePathInProject) {
        if (!StringUtils.hasText(projectPath)) {
            throw new IllegalArgumentException("项目路径不能为空");
        }
        Path workspaceRoot = getWorkspaceRoot();
        Path projectRoot = workspaceRoot.resolve(projectPath).normalize();

        if (!projectRoot.startsWith(workspaceRoot) || projectPath.contains("..")) {
            throw new IllegalArgumentException("项目路径无效: " + projectPath);
        }
        if (!StringUtils.hasText(relativePathInProject)) {
            throw new IllegalArgumentException("文件路径不能为空");
        }

        Path resolvedPath = projectRoot.resolve(relativePathInProject).normalize();
        if (!resolvedPath.startsWith(projectRoot) || resolvedPath.equals(projectRoot)) {
            throw new IllegalArgumentException("检测到路径遍历攻击: " + relativePathInProject);
        }
        return resolvedPath;
    }
}
