package com.gateflow.dispatch.api;

import com.gateflow.core.GateflowProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool for pipelines submitted over HTTP. Submissions beyond the queue are rejected
 * rather than piling up.
 */
@Configuration
public class PipelineExecutorConfig {

    static final int QUEUE_PER_WORKER = 4;

    @Bean(name = "pipelineExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(GateflowProperties properties) {
        int threads = Math.max(1, properties.getApi().getMaxConcurrentRuns());
        var counter = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(threads * QUEUE_PER_WORKER),
                r -> {
                    Thread t = new Thread(r, "pipeline-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }
}
