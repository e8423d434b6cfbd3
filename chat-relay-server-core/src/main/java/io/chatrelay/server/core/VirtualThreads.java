package io.chatrelay.server.core;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for delivery and notification work. Uses virtual threads when the runtime offers them.
 */
final class VirtualThreads {
    private VirtualThreads() {
    }

    static ExecutorService newExecutor(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        Method factory;
        try {
            factory = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
        } catch (NoSuchMethodException e) {
            return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
        }
        try {
            return (ExecutorService) factory.invoke(null);
        } catch (ReflectiveOperationException e) {
            // preview-only runtimes refuse the call without --enable-preview
            return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
        }
    }

    /** Single daemon thread; pulse tasks only enqueue writes, so they never block it. */
    static ScheduledExecutorService newScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(name));
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
