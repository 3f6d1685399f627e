package com.prioritymind.core.session;

/**
 * No session is stored under the requested id.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
