package com.gateflow.core;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "gateflow")
public class GateflowProperties {

    private State state = new State();
    private Worker worker = new Worker();
    private Healing healing = new Healing();
    private Validation validation = new Validation();
    private Page page = new Page();
    private Api api = new Api();

    // -- Convenience accessors (delegate to nested) --
    public String getStateProvider() { return state.provider; }
    public String getStateDirectory() { return state.directory; }
    public int getMaxRuns() { return healing.maxRuns; }
    public int getMaxHealingAttempts() { return healing.maxAttempts; }
    public int getPassThreshold() { return validation.passThreshold; }
    public int getPartialThreshold() { return validation.partialThreshold; }
    public int getPageTimeoutSeconds() { return page.timeoutSeconds; }

    /**
     * Timeout for the worker behind the given gate. Execution-class workers (the executor
     * and the healer) get the longer execution timeout.
     */
    public int timeoutSecondsFor(String workerName) {
        Integer override = worker.timeouts.get(workerName);
        if (override != null) {
            return override;
        }
        if ("test-executor".equals(workerName) || "test-healer".equals(workerName)) {
            return worker.executionTimeoutSeconds;
        }
        return worker.defaultTimeoutSeconds;
    }

    public State getState() { return state; }
    public void setState(State state) { this.state = state; }
    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Healing getHealing() { return healing; }
    public void setHealing(Healing healing) { this.healing = healing; }
    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }
    public Page getPage() { return page; }
    public void setPage(Page page) { this.page = page; }
    public Api getApi() { return api; }
    public void setApi(Api api) { this.api = api; }

    public static class State {
        /** "file" or "jdbc". */
        private String provider = "file";
        private String directory = ".gateflow/state";
        private Jdbc jdbc = new Jdbc();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public Jdbc getJdbc() { return jdbc; }
        public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }
    }

    public static class Jdbc {
        private String url;
        private String username;
        private String password;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    public static class Worker {
        /** "http" or "command". */
        private String transport = "http";
        private String baseUrl = "http://localhost:8090";
        private int defaultTimeoutSeconds = 120;
        private int executionTimeoutSeconds = 600;
        /** Per-worker timeout overrides keyed by worker name. */
        private Map<String, Integer> timeouts = new HashMap<>();
        /** Per-worker commands for the command transport, keyed by worker name. */
        private Map<String, String> commands = new HashMap<>();

        public String getTransport() { return transport; }
        public void setTransport(String transport) { this.transport = transport; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public int getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
        public void setDefaultTimeoutSeconds(int v) { this.defaultTimeoutSeconds = v; }
        public int getExecutionTimeoutSeconds() { return executionTimeoutSeconds; }
        public void setExecutionTimeoutSeconds(int v) { this.executionTimeoutSeconds = v; }
        public Map<String, Integer> getTimeouts() { return timeouts; }
        public void setTimeouts(Map<String, Integer> timeouts) { this.timeouts = timeouts; }
        public Map<String, String> getCommands() { return commands; }
        public void setCommands(Map<String, String> commands) { this.commands = commands; }
    }

    public static class Healing {
        private int maxRuns = 6;
        private int maxAttempts = 3;

        public int getMaxRuns() { return maxRuns; }
        public void setMaxRuns(int maxRuns) { this.maxRuns = maxRuns; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Validation {
        private int passThreshold = 70;
        private int partialThreshold = 50;

        public int getPassThreshold() { return passThreshold; }
        public void setPassThreshold(int passThreshold) { this.passThreshold = passThreshold; }
        public int getPartialThreshold() { return partialThreshold; }
        public void setPartialThreshold(int partialThreshold) { this.partialThreshold = partialThreshold; }
    }

    public static class Page {
        private int timeoutSeconds = 30;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Api {
        private int maxConcurrentRuns = 4;

        public int getMaxConcurrentRuns() { return maxConcurrentRuns; }
        public void setMaxConcurrentRuns(int maxConcurrentRuns) { this.maxConcurrentRuns = maxConcurrentRuns; }
    }
}
