package com.raditha.extract.source;

/**
 * Result of applying edits.
 *
 * @param applied True when every edit was written
 * @param version New version when applied, the current version when stale
 * @param detail  Explanation for a rejected change
 */
public record EditOutcome(boolean applied, long version, String detail) {

    public static EditOutcome applied(long newVersion) {
        return new EditOutcome(true, newVersion, null);
    }

    public static EditOutcome stale(long expectedVersion, long currentVersion) {
        return new EditOutcome(false, currentVersion,
                "expected version " + expectedVersion + " but document is at " + currentVersion);
    }
}
