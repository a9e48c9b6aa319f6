/**
 * SourceParseException.java
 *
 * 词法分析阶段遇到无法恢复的错误 (如字符串或块注释未闭合) 时抛出。
 * 仅在解析器内部使用，ConstructTreeParser 会将其转换为根节点上的诊断信息。
 */
package club.ppmc.visualsync.engine.parser;

import lombok.Getter;

@Getter
public class SourceParseException extends RuntimeException {

    private final int line;

    public SourceParseException(int line, String message) {
        super("[第 " + line + " 行] " + message);
        this.line = line;
    }
}
