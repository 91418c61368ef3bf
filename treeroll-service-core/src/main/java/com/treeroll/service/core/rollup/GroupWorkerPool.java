package com.treeroll.service.core.rollup;

import com.treeroll.service.core.config.RollupProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the per-group work of one level, in parallel when {@code treeroll.rollup.parallelism} is above one.
 * Results come back in input order and only once every group has finished.
 */
@Slf4j
@Component
public class GroupWorkerPool {

    private final RollupProperties properties;
    private ExecutorService executor;

    public GroupWorkerPool(RollupProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void start() {
        init(properties.getRollup().getParallelism());
    }

    void init(int workers) {
        if (workers <= 1) {
            log.info("Rollup group workers: sequential");
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "rollup-group-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        executor = Executors.newFixedThreadPool(workers, threads);
        log.info("Rollup group workers started workers={}", workers);
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public <T, R> List<R> mapAll(List<T> items, Function<T, R> task) {
        if (executor == null || items.size() < 2) {
            List<R> out = new ArrayList<>(items.size());
            for (T item : items) {
                out.add(task.apply(item));
            }
            return out;
        }
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(executor.submit(() -> task.apply(item)));
        }
        List<R> out = new ArrayList<>(items.size());
        try {
            for (Future<R> future : futures) {
                out.add(future.get());
            }
            return out;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while aggregating groups", ie);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Group aggregation failed", ex.getCause());
        } finally {
            for (Future<R> future : futures) {
                future.cancel(true);
            }
        }
    }
}
