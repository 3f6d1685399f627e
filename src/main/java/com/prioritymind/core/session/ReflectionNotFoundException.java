package com.prioritymind.core.session;

public class ReflectionNotFoundException extends RuntimeException {

    public ReflectionNotFoundException(String sessionId, String reflectionId) {
        super("Reflection " + reflectionId + " not found in session " + sessionId);
    }
}
