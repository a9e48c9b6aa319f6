/**
 * SyncState.java
 *
 * 同步编排器的状态。处于任一 "APPLYING" 状态时，另一方向的处理会被抑制，
 * 直到计划中的重新解析完成，以避免代码视图与可视视图之间的反馈循环。
 */
package club.ppmc.visualsync.model;

public enum SyncState {
    IDLE,
    APPLYING_FROM_CODE,
    APPLYING_FROM_VISUAL
}
