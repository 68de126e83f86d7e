package com.intermission.scheduler.service;

import com.intermission.scheduler.exception.AdmissionUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The single thread that owns all scheduler state. The periodic tick runs on it
 * (see LoopConfig) and every call arriving from Kafka or HTTP is posted to it.
 */
@Slf4j
@Component
public class AdmissionLoop {

    private final ThreadPoolTaskScheduler taskScheduler;
    private final long callTimeoutMs;

    public AdmissionLoop(@Qualifier("admissionTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
                         @Value("${intermission.call-timeout-ms:2000}") long callTimeoutMs) {
        this.taskScheduler = taskScheduler;
        this.callTimeoutMs = callTimeoutMs;
    }

    /** Fire-and-forget. Failures are logged on the loop thread. */
    public void execute(String operation, Runnable task) {
        try {
            taskScheduler.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Admission task {} failed", operation, e);
                }
            });
        } catch (TaskRejectedException e) {
            throw new AdmissionUnavailableException(operation, "Admission loop is not accepting work", e);
        }
    }

    /** Runs {@code task} on the loop and waits for its result. */
    public <T> T call(String operation, Callable<T> task) {
        Future<T> future;
        try {
            future = taskScheduler.submit(task);
        } catch (TaskRejectedException e) {
            throw new AdmissionUnavailableException(operation, "Admission loop is not accepting work", e);
        }
        try {
            return future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new AdmissionUnavailableException(operation, "Interrupted while waiting for admission loop", e);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new AdmissionUnavailableException(operation,
                    "Admission loop did not answer within " + callTimeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new AdmissionUnavailableException(operation, "Admission task failed: " + cause, cause);
        }
    }
}
