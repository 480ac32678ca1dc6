package com.flowo.live.core.session;

/**
 * The hub already serves its configured maximum number of sessions.
 */
public class SessionLimitExceededException extends RuntimeException {

    public SessionLimitExceededException(int maxSessions) {
        super("Live session limit reached (" + maxSessions + ")");
    }
}
