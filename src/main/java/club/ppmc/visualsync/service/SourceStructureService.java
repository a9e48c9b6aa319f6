/**
 * SourceStructureService.java
 *
 * 无状态的源码结构分析服务。
 * 与 DocumentSessionService 不同，它不持有任何会话状态，每次调用都重新读取并解析，
 * 供前端在不打开文档的情况下预览某个文件的构造体树。
 */
package club.ppmc.visualsync.service;

import club.ppmc.visualsync.engine.parser.ConstructTreeParser;
import club.ppmc.visualsync.model.tree.ConstructNode;
import club.ppmc.visualsync.model.tree.RootNode;
import java.io.IOException;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class SourceStructureService {

    private final FileService fileService;
    private final ConstructTreeParser parser = new ConstructTreeParser();

    public SourceStructureService(FileService fileService) {
        this.fileService = fileService;
    }

    public RootNode parseFile(String projectPath, String path) throws IOException {
        String text = fileService.readFileContent(projectPath, path);
        return parser.parseTree(text, fileService.displayPath(projectPath, path));
    }

    public RootNode parseText(String text, String path) {
        return parser.parseTree(text, path);
    }

    public Optional<ConstructNode> nodeAtLine(String projectPath, String path, int line) throws IOException {
        return parser.findNodeAtLine(parseFile(projectPath, path), line);
    }
}
