package com.williamcallahan.chapter_sync_engine.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up {@link SourceClient} beans by provider name.
 */
@Slf4j
@Component
public class SourceClientRegistry {

    private final Map<String, SourceClient> clients = new ConcurrentHashMap<>();

    public SourceClientRegistry(List<SourceClient> sourceClients) {
        for (SourceClient client : sourceClients) {
            register(client);
        }
        log.info("Registered {} source clients: {}", clients.size(), clients.keySet());
    }

    public void register(SourceClient client) {
        SourceClient previous = clients.put(key(client.sourceName()), client);
        if (previous != null && previous != client) {
            log.warn("Source client for '{}' replaced by {}", client.sourceName(), client.getClass().getSimpleName());
        }
    }

    public Optional<SourceClient> find(String sourceName) {
        if (sourceName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(key(sourceName)));
    }

    public Set<String> sourceNames() {
        return Collections.unmodifiableSet(clients.keySet());
    }

    private static String key(String sourceName) {
        return sourceName.trim().toLowerCase(Locale.ROOT);
    }
}
