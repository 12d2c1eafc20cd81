package io.rangekeeper.provisioner;

import io.rangekeeper.error.ProvisionerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

public final class ProvisionerGateway implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ProvisionerGateway.class);

    private final Provisioner provisioner;
    private final int maxAttempts;
    private final long timeoutMs;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final ExecutorService executor;

    public ProvisionerGateway(Provisioner provisioner, int maxAttempts, long timeoutMs, long baseBackoffMs, long maxBackoffMs) {
        this.provisioner = provisioner;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.timeoutMs = Math.max(1L, timeoutMs);
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "rangekeeper-provisioner-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public WorkloadHandle start(WorkloadSpec spec) throws ProvisionerException {
        return call("start instance=" + spec.instanceId(), () -> provisioner.start(spec));
    }

    public void stop(WorkloadHandle handle) throws ProvisionerException {
        call("stop handle=" + handle.value(), () -> {
            provisioner.stop(handle);
            return null;
        });
    }

    private <T> T call(String operation, Callable<T> work) throws ProvisionerException {
        ProvisionerException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return once(work);
            } catch (ProvisionerException e) {
                if (!e.isTransient()) {
                    LOG.warn("Provisioner rejected {}: {}", operation, e.getMessage());
                    throw e;
                }
                last = e;
                if (attempt < maxAttempts) {
                    long delay = backoffMs(attempt);
                    LOG.warn("Provisioner {} failed (attempt {}/{}), retrying in {} ms: {}",
                            operation, attempt, maxAttempts, delay, e.getMessage());
                    sleep(delay);
                }
            }
        }
        LOG.error("Provisioner {} gave up after {} attempts", operation, maxAttempts);
        throw last;
    }

    private <T> T once(Callable<T> work) throws ProvisionerException {
        Future<T> future;
        try {
            future = executor.submit(work);
        } catch (RuntimeException e) {
            throw ProvisionerException.transientFailure("provisioner executor unavailable", e);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ProvisionerException.transientFailure("provisioner call timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw ProvisionerException.transientFailure("interrupted while waiting for provisioner", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProvisionerException) {
                throw (ProvisionerException) cause;
            }
            throw new ProvisionerException("provisioner failed: " + cause, false, cause);
        }
    }

    long backoffMs(int attempt) {
        if (baseBackoffMs == 0L) {
            return 0L;
        }
        long exp = baseBackoffMs << Math.min(20, attempt - 1);
        long capped = Math.min(maxBackoffMs, exp);
        long jitter = ThreadLocalRandom.current().nextLong(0L, Math.max(1L, capped / 4L + 1L));
        return Math.min(maxBackoffMs, capped + jitter);
    }

    private static void sleep(long ms) throws ProvisionerException {
        if (ms <= 0L) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProvisionerException.transientFailure("interrupted during provisioner backoff", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
