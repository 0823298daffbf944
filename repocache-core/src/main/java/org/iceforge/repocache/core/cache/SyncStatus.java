package org.iceforge.repocache.core.cache;

import java.time.Instant;

/**
 * Outcome of the most recent hydration attempt, successful or not.
 *
 * @param statusCode HTTP(-equivalent) status; 200 on success, 0 before any attempt
 * @param error      failure message, null on success
 * @param at         when the attempt finished, null before any attempt
 */
public record SyncStatus(int statusCode, String error, Instant at) {

    public static final int OK = 200;

    public static SyncStatus notYetSynced() {
        return new SyncStatus(0, null, null);
    }

    public static SyncStatus success(Instant at) {
        return new SyncStatus(OK, null, at);
    }

    public static SyncStatus failure(int statusCode, String error, Instant at) {
        return new SyncStatus(statusCode, error, at);
    }

    public boolean isSuccess() {
        return statusCode == OK;
    }
}
