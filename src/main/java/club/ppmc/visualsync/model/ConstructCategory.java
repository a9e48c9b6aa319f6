/**
 * ConstructCategory.java
 *
 * 构造体的展示分类，仅供外部消费者分组显示使用，不影响树结构。
 */
package club.ppmc.visualsync.model;

public enum ConstructCategory {
    APP,
    LAYOUT,
    INPUT,
    DISPLAY,
    GENERIC
}
