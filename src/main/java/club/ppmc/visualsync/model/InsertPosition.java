/**
 * InsertPosition.java
 */
package club.ppmc.visualsync.model;

public enum InsertPosition {
    BEFORE,
    AFTER,
    AS_CHILD
}
