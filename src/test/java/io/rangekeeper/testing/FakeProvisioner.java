package io.rangekeeper.testing;

import io.rangekeeper.error.ProvisionerException;
import io.rangekeeper.provisioner.Provisioner;
import io.rangekeeper.provisioner.WorkloadHandle;
import io.rangekeeper.provisioner.WorkloadSpec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provisioner. Failures are queued per call or pinned to a handle; a gate can
 * hold start or stop calls until the test releases them.
 */
public final class FakeProvisioner implements Provisioner {
    private final AtomicInteger startCalls = new AtomicInteger();
    private final AtomicInteger stopCalls = new AtomicInteger();
    private final Deque<ProvisionerException> startFailures = new ArrayDeque<>();
    private final Deque<ProvisionerException> stopFailures = new ArrayDeque<>();
    private final Map<String, String> flagsByInstance = new ConcurrentHashMap<>();
    private final Set<String> live = ConcurrentHashMap.newKeySet();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private volatile CountDownLatch startGate;
    private volatile CountDownLatch stopGate;
    private final CountDownLatch startEntered = new CountDownLatch(1);
    private final CountDownLatch stopEntered = new CountDownLatch(1);

    @Override
    public WorkloadHandle start(WorkloadSpec spec) throws ProvisionerException {
        startCalls.incrementAndGet();
        startEntered.countDown();
        await(startGate);
        ProvisionerException failure = poll(startFailures);
        if (failure != null) {
            throw failure;
        }
        flagsByInstance.put(spec.instanceId(), spec.flag().value());
        String handle = "fake-" + spec.instanceId();
        live.add(handle);
        return new WorkloadHandle(handle);
    }

    @Override
    public void stop(WorkloadHandle handle) throws ProvisionerException {
        stopCalls.incrementAndGet();
        stopEntered.countDown();
        await(stopGate);
        if (unreachable.contains(handle.value())) {
            throw ProvisionerException.rejected("node hosting " + handle.value() + " is unreachable");
        }
        ProvisionerException failure = poll(stopFailures);
        if (failure != null) {
            throw failure;
        }
        live.remove(handle.value());
    }

    public synchronized FakeProvisioner failNextStart(ProvisionerException e) {
        startFailures.add(e);
        return this;
    }

    public synchronized FakeProvisioner failNextStop(ProvisionerException e) {
        stopFailures.add(e);
        return this;
    }

    // Every stop of this handle fails until the test says otherwise.
    public FakeProvisioner markUnreachable(String handle) {
        unreachable.add(handle);
        return this;
    }

    public FakeProvisioner markReachable(String handle) {
        unreachable.remove(handle);
        return this;
    }

    public CountDownLatch holdStarts() {
        CountDownLatch gate = new CountDownLatch(1);
        startGate = gate;
        return gate;
    }

    public CountDownLatch holdStops() {
        CountDownLatch gate = new CountDownLatch(1);
        stopGate = gate;
        return gate;
    }

    public boolean awaitStartEntered(long timeoutMs) throws InterruptedException {
        return startEntered.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public boolean awaitStopEntered(long timeoutMs) throws InterruptedException {
        return stopEntered.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public int startCalls() {
        return startCalls.get();
    }

    public int stopCalls() {
        return stopCalls.get();
    }

    public String flagFor(String instanceId) {
        return flagsByInstance.get(instanceId);
    }

    public boolean isLive(String handle) {
        return live.contains(handle);
    }

    public int liveCount() {
        return live.size();
    }

    private synchronized ProvisionerException poll(Deque<ProvisionerException> queue) {
        return queue.poll();
    }

    private static void await(CountDownLatch gate) throws ProvisionerException {
        if (gate == null) {
            return;
        }
        try {
            if (!gate.await(30, TimeUnit.SECONDS)) {
                throw ProvisionerException.transientFailure("fake provisioner gate never opened", null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProvisionerException.transientFailure("interrupted", e);
        }
    }
}
