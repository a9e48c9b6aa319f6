/**
 * ParseSourceRequest.java
 *
 * 结构分析请求：text 不为空时直接解析该文本，否则读取工作区中的文件。
 */
package club.ppmc.visualsync.model.request;

public record ParseSourceRequest(String projectPath, String path, String text) {

    public boolean hasText() {
        return text != null;
    }
}
