/**
 * SyncOptions.java
 *
 * 同步编排器的可调参数。
 */
package club.ppmc.visualsync.engine.sync;

import java.time.Duration;

public record SyncOptions(
        Duration rawEditDebounce, Duration attributeDebounce, int historyLimit, int snippetMaxLength) {

    public static final int DEFAULT_HISTORY_LIMIT = 100;

    public static SyncOptions defaults() {
        return new SyncOptions(
                Duration.ofMillis(300), Duration.ofMillis(500), DEFAULT_HISTORY_LIMIT, 200);
    }
}
