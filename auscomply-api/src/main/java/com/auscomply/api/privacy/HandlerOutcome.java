package com.auscomply.api.privacy;

/**
 * Result of running a data-subject request handler: completed (optionally with an
 * export) or rejected with a reason.
 */
public record HandlerOutcome(boolean completed, String exportUrl, String notes, String rejectionReason) {

    public static HandlerOutcome completed(String notes) {
        return new HandlerOutcome(true, null, notes, null);
    }

    public static HandlerOutcome exported(String exportUrl, String notes) {
        return new HandlerOutcome(true, exportUrl, notes, null);
    }

    public static HandlerOutcome rejected(String reason) {
        return new HandlerOutcome(false, null, null, reason);
    }
}
