package com.frenchtoast.alert.core.model;

/**
 * Outcome of one change-detection pass.
 *
 * @param changed true only when this pass committed a new status
 * @param status  the status row as seen after the pass (the new row when changed)
 * @param level   the level of {@code status}, null when the stored value is not a level
 */
public record ChangeResult(boolean changed, Status status, AlertLevel level) {

    public static ChangeResult changed(Status status, AlertLevel level) {
        return new ChangeResult(true, status, level);
    }

    public static ChangeResult unchanged(Status status) {
        return new ChangeResult(false, status, status.level().orElse(null));
    }
}
