/**
 * CommandOutcome.java
 *
 * 编排器命令的执行结果。
 * NO_OP 表示无法定位目标 (缓冲区未改变)，DROPPED 表示因反方向正在应用而被丢弃。
 */
package club.ppmc.visualsync.model;

public enum CommandOutcome {
    APPLIED,
    NO_OP,
    DROPPED
}
