package com.eainde.vocab.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that carries the submitting thread's MDC into the task, so background
 * generation logs keep their {@code taskId} and {@code topic}.
 */
public class MdcAwareExecutor implements Executor {

    private final Executor delegate;

    public MdcAwareExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    /**
     * Cached pool of daemon threads named {@code prefix-N}.
     */
    public static MdcAwareExecutor daemonPool(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ExecutorService pool = Executors.newCachedThreadPool(factory);
        return new MdcAwareExecutor(pool);
    }

    /**
     * Stops accepting tasks when the delegate is an {@link ExecutorService}; running tasks finish.
     */
    public void shutdown() {
        if (delegate instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    public boolean isShutdown() {
        return delegate instanceof ExecutorService service && service.isShutdown();
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> workerMdc = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                // Put back whatever the worker had, which is the caller's own context on a direct executor
                if (workerMdc != null) {
                    MDC.setContextMap(workerMdc);
                } else {
                    MDC.clear();
                }
            }
        });
    }
}
