/**
 * SourceFormattingException.java
 *
 * 外部格式化器处理失败时抛出的受检异常 (进程启动失败、非零退出码、超时等)。
 * 格式化只是尽力而为：StructuralMutator 捕获此异常后返回未格式化但结构正确的文本。
 */
package club.ppmc.visualsync.exception;

public class SourceFormattingException extends Exception {

    public SourceFormattingException(String message) {
        super(message);
    }

    public SourceFormattingException(String message, Throwable cause) {
        super(message, cause);
    }
}
