package com.gateflow.worker;

/**
 * Thrown when a worker cannot be reached, crashes, times out, or answers with a payload
 * that is not a valid {@link WorkerResponse}.
 */
public class WorkerInvocationException extends RuntimeException {

    private final String worker;

    public WorkerInvocationException(String worker, String message) {
        super(message);
        this.worker = worker;
    }

    public WorkerInvocationException(String worker, String message, Throwable cause) {
        super(message, cause);
        this.worker = worker;
    }

    public String getWorker() {
        return worker;
    }
}
