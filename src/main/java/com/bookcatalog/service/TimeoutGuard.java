package com.bookcatalog.service;

import com.bookcatalog.config.CatalogProperties;
import com.bookcatalog.exception.OperationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/** Races a blocking call against a deadline; the loser is abandoned, not interrupted. */
@Component
public class TimeoutGuard {

    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private final Executor executor;
    private final TaskScheduler scheduler;
    private final Duration timeout;

    @Autowired
    public TimeoutGuard(@Qualifier("catalogQueryExecutor") Executor executor,
                        @Qualifier("catalogTimeoutScheduler") TaskScheduler scheduler,
                        CatalogProperties properties) {
        this(executor, scheduler, properties.queryTimeout());
    }

    public TimeoutGuard(Executor executor, TaskScheduler scheduler, Duration timeout) {
        this.executor = executor;
        this.scheduler = scheduler;
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public <T> CompletableFuture<T> supply(Supplier<T> operation) {
        CompletableFuture<T> promise = new CompletableFuture<>();

        ScheduledFuture<?> timer = scheduler.schedule(
            () -> promise.completeExceptionally(new OperationTimeoutException(timeout)),
            Instant.now().plus(timeout));

        try {
            executor.execute(() -> {
                try {
                    T result = operation.get();
                    if (!promise.complete(result)) {
                        log.debug("Discarding result of an operation that exceeded {}", timeout);
                    }
                } catch (RuntimeException | Error ex) {
                    if (!promise.completeExceptionally(ex)) {
                        log.debug("Operation failed after its {} deadline: {}", timeout, ex.toString());
                    }
                }
            });
        } catch (RejectedExecutionException ex) {
            promise.completeExceptionally(ex);
        }

        promise.whenComplete((result, ex) -> timer.cancel(false));
        return promise;
    }
}
