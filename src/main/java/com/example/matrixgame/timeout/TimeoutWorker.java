package com.example.matrixgame.timeout;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import com.example.matrixgame.global.config.TimeoutProperties;
import com.example.matrixgame.timeout.dto.SweepResult;
import com.example.matrixgame.timeout.service.TimeoutService;

/**
 * Runs the timeout sweep on a fixed delay. Sweeps never overlap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimeoutWorker {

    private final TaskScheduler taskScheduler;
    private final TimeoutService timeoutService;
    private final TimeoutProperties timeoutProperties;

    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (timeoutProperties.enabled()) {
            start();
        } else {
            log.info("[timeout] worker disabled");
        }
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        scheduledTask = taskScheduler.scheduleWithFixedDelay(this::runSweep,
                Instant.now().plus(timeoutProperties.initialDelay()), timeoutProperties.interval());
        log.info("[timeout] worker started: interval={}", timeoutProperties.interval());
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
            log.info("[timeout] worker stopped");
        }
    }

    public synchronized boolean isRunning() {
        return scheduledTask != null && !scheduledTask.isCancelled();
    }

    /**
     * One sweep. Returns empty when another sweep is still in progress.
     */
    public Optional<SweepResult> runSweep() {
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("[timeout] sweep already running, skipped");
            return Optional.empty();
        }
        try {
            return Optional.of(timeoutService.processAllTimeouts());
        } catch (RuntimeException e) {
            log.error("[timeout] sweep failed", e);
            return Optional.empty();
        } finally {
            sweeping.set(false);
        }
    }
}
