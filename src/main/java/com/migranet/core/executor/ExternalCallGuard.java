package com.migranet.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ExternalCallGuard: runs blocking collaborator calls (JDBC, HTTP, console tool)
 * under a time budget.
 *
 * The caller blocks on the future. On timeout the task is cancelled with interrupt
 * and TimeoutException is raised. If the caller itself is interrupted the task is
 * cancelled and MigrationCancelledException is raised.
 */
@Component
public class ExternalCallGuard {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallGuard.class);

    private final ExecutorService workers;

    public ExternalCallGuard() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "migranet-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.workers = Executors.newCachedThreadPool(factory);
    }

    /**
     * @param label   short name for logs, e.g. "deploy HR.EMPLOYEES"
     * @throws TimeoutException   budget exceeded; the task has been cancelled
     * @throws ExecutionException the call itself threw; see getCause()
     */
    public <T> T call(String label, Duration timeout, Callable<T> task)
            throws TimeoutException, ExecutionException {

        Future<T> future = workers.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[CallGuard] {} timed out after {}s", label, timeout.toSeconds());
            throw e;

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("[CallGuard] {} interrupted, cancelling", label);
            throw new MigrationCancelledException("Interrupted during " + label, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
