package com.aletheia.engine.core.event;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for asynchronous event observers. Observers may block for a whole
 * notification window, so the pool is sized by config rather than by CPU count.
 */
@ApplicationScoped
public class EventExecutorProducer {

    @ConfigProperty(name = "aletheia.events.async-threads", defaultValue = "16")
    int asyncThreads;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("eventExecutor")
    public ExecutorService eventExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "task-event-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        executor = Executors.newFixedThreadPool(asyncThreads, factory);
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
