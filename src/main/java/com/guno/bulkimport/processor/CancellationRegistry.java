package com.guno.bulkimport.processor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation flags of running submissions, checked between rows
 */
@Component
@Slf4j
public class CancellationRegistry {

    private final Set<Long> cancelled = ConcurrentHashMap.newKeySet();

    public void cancel(long submissionId) {
        if (cancelled.add(submissionId)) {
            log.info("🛑 Cancellation requested for submission #{}", submissionId);
        }
    }

    public boolean isCancelled(long submissionId) {
        return cancelled.contains(submissionId);
    }

    public void clear(long submissionId) {
        cancelled.remove(submissionId);
    }
}
