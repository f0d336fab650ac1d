package com.lorekeeper.core.dispatch;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for concurrent sub-dispatches.
 * <p>
 * Parents block while their children run, so the pool is unbounded; a bounded pool could
 * starve a deep tree.
 */
@Configuration
public class DispatchExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService dispatchExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
