package com.dds.app.session;

/**
 * Session bookkeeping hit a storage error it cannot recover from. The session has been
 * (or could not even be) marked {@link SessionStatus#FAILED}.
 */
public class SessionFailedException extends RuntimeException {

    private final String sessionId;

    public SessionFailedException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
