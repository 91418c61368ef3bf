package com.treeroll.service.core.config.init;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.treeroll.service.core.config.DefinitionsMaterializer;
import com.treeroll.service.core.config.RegistrySnapshot;
import com.treeroll.service.core.config.RollupProperties;
import com.treeroll.service.core.config.RollupRegistry;
import com.treeroll.service.core.config.model.RollupDefinitions;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Loads rollup definitions into the {@link RollupRegistry} at startup and on demand. */
@Slf4j
@Component
public class DefinitionsInitializer {

    private final RollupRegistry registry;
    private final RollupProperties properties;
    private final ObjectMapper objectMapper;
    private final DefinitionsMaterializer materializer = new DefinitionsMaterializer();
    private final ReentrantLock lock = new ReentrantLock();

    public DefinitionsInitializer(RollupRegistry registry, RollupProperties properties, ObjectMapper objectMapper) {
        this.registry = registry;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        RollupProperties.Definitions definitions = properties.getDefinitions();
        log.info("Definitions startup: enabled={}, location={}", definitions.isEnabled(), definitions.getLocation());
        if (!definitions.isEnabled()) {
            return;
        }
        reload();
    }

    /**
     * Re-reads every definitions file and swaps the registry snapshot. A failing load leaves the previous
     * snapshot in place and rethrows.
     */
    public RegistrySnapshot reload() {
        String location = properties.getDefinitions().getLocation();
        lock.lock();
        long t0 = System.nanoTime();
        try {
            List<RollupDefinitions> files = new ResourceDefinitionsSource(location, objectMapper).load();
            RegistrySnapshot snapshot = materializer.materialize(files, Instant.now());
            registry.swap(snapshot);
            log.info(
                    "Definitions loaded from {}: metrics={}, dimensions={}, hierarchies={}, catalog={} in {} ms",
                    location,
                    snapshot.metrics().size(),
                    snapshot.dimensions().size(),
                    snapshot.hierarchies().size(),
                    snapshot.catalog().size(),
                    (System.nanoTime() - t0) / 1_000_000L);
            return snapshot;
        } catch (IOException ex) {
            log.error("Definitions load failed for {}", location, ex);
            throw new IllegalStateException("Failed to load rollup definitions from " + location, ex);
        } finally {
            lock.unlock();
        }
    }
}
