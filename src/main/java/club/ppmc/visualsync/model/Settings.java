/**
 * Settings.java
 *
 * 可视化同步后端的各项配置。
 * 由 SettingsService 负责加载和保存到工作区的 .ide/settings.json 文件中。
 * 它是一个可变对象，以便于 Jackson 进行序列化和反序列化。
 */
package club.ppmc.visualsync.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class Settings {

    /**
     * 工作区根目录。所有可编辑的项目都存放在此目录下。
     */
    private String workspaceRoot = "./workspace";

    // --- 格式化器 ---
    /**
     * 外部格式化器命令及其参数，例如 ["dart", "format", "--output=show"]。
     * 格式化器从标准输入读取源码并把结果写到标准输出。为空表示不进行格式化。
     */
    private List<String> formatterCommand = new ArrayList<>();

    private int formatterTimeoutSeconds = 10;

    /** 结构化编辑之后是否调用格式化器。 */
    private boolean formatOnMutation = true;

    // --- 同步引擎 ---
    private long rawEditDebounceMillis = 300;
    private long attributeDebounceMillis = 500;
    private int historyLimit = 100;
}
