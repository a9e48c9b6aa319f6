/**
 * SourceBuffer.java
 *
 * 当前打开文件的完整文本快照。
 * 不可变；每次编辑都会整体替换为新的实例，而不是在原地修补。
 */
package club.ppmc.visualsync.model;

import java.time.Instant;

public record SourceBuffer(String path, String text, boolean dirty, Instant lastModified) {

    public static SourceBuffer open(String path, String text) {
        return new SourceBuffer(path, text == null ? "" : text, false, Instant.now());
    }

    public SourceBuffer withText(String newText) {
        return new SourceBuffer(path, newText, true, Instant.now());
    }

    public SourceBuffer markSaved() {
        return new SourceBuffer(path, text, false, lastModified);
    }
}
