package io.rangekeeper.reaper;

import io.rangekeeper.lifecycle.ExpireResult;
import io.rangekeeper.lifecycle.InstanceLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public final class ExpiryReaper implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ExpiryReaper.class);

    private final InstanceLifecycleManager lifecycle;
    private final Clock clock;
    private final int batchSize;
    private final long intervalMs;
    private final long claimTimeoutMs;
    private final AtomicLong sweeps = new AtomicLong();
    private final AtomicLong expiredTotal = new AtomicLong();
    private final AtomicLong teardownFailuresTotal = new AtomicLong();
    private final AtomicLong sweepErrors = new AtomicLong();
    private ScheduledExecutorService scheduler;

    public ExpiryReaper(InstanceLifecycleManager lifecycle, Clock clock, int batchSize, long intervalMs, long claimTimeoutMs) {
        this.lifecycle = lifecycle;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
        this.intervalMs = Math.max(1L, intervalMs);
        this.claimTimeoutMs = Math.max(1L, claimTimeoutMs);
    }

    public SweepSummary sweep() {
        long started = clock.millis();
        int claimsReleased = 0;
        try {
            claimsReleased = lifecycle.releaseStaleClaims(claimTimeoutMs).size();
        } catch (RuntimeException e) {
            LOG.warn("Stale claim recovery failed: {}", e.getMessage());
        }
        List<String> candidates = lifecycle.listExpired(batchSize);
        int expired = 0;
        int notDue = 0;
        int skipped = 0;
        int failed = 0;
        int errors = 0;
        for (String instanceId : candidates) {
            try {
                ExpireResult result = lifecycle.expire(instanceId);
                switch (result) {
                    case EXPIRED -> expired++;
                    case NOT_DUE -> notDue++;
                    case SKIPPED -> skipped++;
                    case TEARDOWN_FAILED -> failed++;
                }
            } catch (RuntimeException e) {
                errors++;
                LOG.error("Expire failed for instance={}: {}", instanceId, e.getMessage(), e);
            }
        }
        sweeps.incrementAndGet();
        expiredTotal.addAndGet(expired);
        teardownFailuresTotal.addAndGet(failed);
        SweepSummary summary = new SweepSummary(candidates.size(), expired, notDue, skipped, failed, errors,
                claimsReleased, started, clock.millis() - started);
        if (!candidates.isEmpty() || claimsReleased > 0) {
            LOG.info("Reaper sweep examined={} expired={} notDue={} skipped={} teardownFailed={} errors={} claimsReleased={}",
                    summary.examined(), expired, notDue, skipped, failed, errors, claimsReleased);
        }
        return summary;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rangekeeper-reaper");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Expiry reaper started intervalMs={} batchSize={}", intervalMs, batchSize);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        LOG.info("Expiry reaper stopped");
    }

    public synchronized boolean running() {
        return scheduler != null;
    }

    // An exception escaping a scheduled task would cancel all later runs.
    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            sweepErrors.incrementAndGet();
            LOG.error("Reaper sweep failed: {}", e.getMessage(), e);
        }
    }

    public Counters counters() {
        return new Counters(sweeps.get(), expiredTotal.get(), teardownFailuresTotal.get(), sweepErrors.get());
    }

    @Override
    public void close() {
        stop();
    }

    public record Counters(long sweeps, long expired, long teardownFailures, long sweepErrors) {
    }
}
