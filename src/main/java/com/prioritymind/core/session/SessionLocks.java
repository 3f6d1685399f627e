package com.prioritymind.core.session;

import com.prioritymind.core.logging.MdcContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per session id, so read-modify-write cycles on one session never interleave.
 * Different sessions proceed in parallel.
 */
@Component
public class SessionLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code work} holding the session's lock, with the session and operation in the MDC.
     */
    public <T> T withLock(String sessionId, String operation, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, k -> new ReentrantLock());
        lock.lock();
        MdcContext.setSession(sessionId, operation);
        try {
            return work.get();
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }
}
