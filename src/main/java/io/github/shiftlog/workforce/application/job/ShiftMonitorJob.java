package io.github.shiftlog.workforce.application.job;

import io.github.shiftlog.workforce.application.service.ShiftMonitorService;
import io.github.shiftlog.workforce.config.WorkforceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Component
@RequiredArgsConstructor
@Slf4j
public class ShiftMonitorJob {

    private final ShiftMonitorService monitorService;
    private final WorkforceProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${workforce.monitor.interval:PT5M}", initialDelayString = "${workforce.monitor.interval:PT5M}")
    public void run() {
        if (!properties.getMonitor().isEnabled()) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Shift monitor sweep still running, skipping this tick");
            return;
        }
        try {
            int recorded = monitorService.sweep();
            log.debug("Shift monitor sweep finished: recorded={}", recorded);
        } catch (Exception e) {
            log.error("Shift monitor sweep failed", e);
        } finally {
            running.set(false);
        }
    }
}
