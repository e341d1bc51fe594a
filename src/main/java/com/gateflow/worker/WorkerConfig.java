package com.gateflow.worker;

import com.gateflow.core.GateflowProperties;
import com.gateflow.core.persistence.StateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Selects the worker transport from {@code gateflow.worker.transport}.
 */
@Configuration
public class WorkerConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfig.class);

    @Bean
    public WorkerInvoker workerInvoker(GateflowProperties properties) {
        var worker = properties.getWorker();
        if ("command".equalsIgnoreCase(worker.getTransport())) {
            log.info("Using command worker transport ({} worker(s) configured)", worker.getCommands().size());
            return new CommandWorkerInvoker(worker.getCommands(), Path.of("").toAbsolutePath(),
                    StateCodec.objectMapper());
        }
        log.info("Using HTTP worker transport at {}", worker.getBaseUrl());
        return new HttpWorkerInvoker(worker.getBaseUrl(), StateCodec.objectMapper());
    }
}
