package com.chatsync.server.retention;

import com.chatsync.core.retention.SweepReport;
import com.chatsync.core.sync.ShareChatRoom;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Daily retention sweep of the shared-storage chat room.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "chatsync.retention.enabled", havingValue = "true")
public class RetentionScheduler {

    @Autowired
    private ShareChatRoom room;

    @Value("${chatsync.retention.days:1}")
    private double daysToKeep;

    private final AtomicLong sweepsRun = new AtomicLong(0);
    private final AtomicLong sweepsFailed = new AtomicLong(0);
    private final AtomicReference<SweepReport> lastReport = new AtomicReference<>();

    @Scheduled(cron = "${chatsync.retention.cron:0 0 2 * * *}")
    public void runSweep() {
        Duration keep = Duration.ofMinutes(Math.round(daysToKeep * 24 * 60));
        log.info("Starting scheduled retention sweep, keeping {} day(s)", daysToKeep);
        try {
            SweepReport report = room.getSweeper().sweepOlderThan(keep);
            lastReport.set(report);
            sweepsRun.incrementAndGet();
        } catch (RuntimeException e) {
            // Next run retries
            sweepsFailed.incrementAndGet();
            log.error("Scheduled retention sweep failed: {}", e.getMessage(), e);
        }
    }

    public long getSweepsRun() {
        return sweepsRun.get();
    }

    public long getSweepsFailed() {
        return sweepsFailed.get();
    }

    public SweepReport getLastReport() {
        return lastReport.get();
    }
}
