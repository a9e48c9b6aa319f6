/**
 * SourceFormatter.java
 *
 * 外部美化器/格式化器的抽象。接收完整源文本，返回格式化后的文本或抛出 SourceFormattingException。
 */
package club.ppmc.visualsync.engine.mutation;

import club.ppmc.visualsync.exception.SourceFormattingException;

@FunctionalInterface
public interface SourceFormatter {

    String format(String source) throws SourceFormattingException;

    /** 不做任何格式化。 */
    static SourceFormatter identity() {
        return source -> source;
    }
}
