package com.williamcallahan.chapter_sync_engine.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Unique identity of this worker process, recorded as the lease owner of every claimed job.
 */
public record WorkerIdentity(String workerId) {

    private static final Logger log = LoggerFactory.getLogger(WorkerIdentity.class);

    public WorkerIdentity {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("Worker id is required");
        }
    }

    /**
     * Configured id when present, otherwise {@code hostname-pid-random}.
     */
    public static WorkerIdentity resolve(String configuredId) {
        if (configuredId != null && !configuredId.isBlank()) {
            return new WorkerIdentity(configuredId.trim());
        }
        String random = UUID.randomUUID().toString().substring(0, 8);
        return new WorkerIdentity(hostname() + "-" + ProcessHandle.current().pid() + "-" + random);
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Unable to resolve hostname for worker id: {}", e.getMessage());
            return "worker";
        }
    }
}
