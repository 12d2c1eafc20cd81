package io.rangekeeper.provisioner;

import io.rangekeeper.error.ProvisionerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class CommandProvisioner implements Provisioner {
    private static final Logger LOG = LoggerFactory.getLogger(CommandProvisioner.class);
    static final int EXIT_TEMPFAIL = 75;
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> startCommand;
    private final List<String> stopCommand;
    private final long timeoutMs;

    public CommandProvisioner(List<String> startCommand, List<String> stopCommand, long timeoutMs) {
        this.startCommand = startCommand == null ? List.of() : List.copyOf(startCommand);
        this.stopCommand = stopCommand == null ? List.of() : List.copyOf(stopCommand);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public WorkloadHandle start(WorkloadSpec spec) throws ProvisionerException {
        if (startCommand.isEmpty()) {
            LOG.warn("No provisioner start command configured, instance={} runs without a workload", spec.instanceId());
            return new WorkloadHandle("none:" + spec.instanceId());
        }
        String output = run(startCommand, Map.of(
                "RK_INSTANCE_ID", spec.instanceId(),
                "RK_PRINCIPAL_ID", spec.principalId(),
                "RK_CHALLENGE_ID", spec.challengeId(),
                "RK_FLAG", spec.flag().value(),
                "RK_EXPIRES_AT_MS", Long.toString(spec.expiresAtMs())
        ));
        String handle = lastNonBlankLine(output);
        if (handle.isEmpty()) {
            throw ProvisionerException.rejected("start command printed no workload handle");
        }
        return new WorkloadHandle(handle);
    }

    @Override
    public void stop(WorkloadHandle handle) throws ProvisionerException {
        if (stopCommand.isEmpty() || handle.value().startsWith("none:")) {
            return;
        }
        run(stopCommand, Map.of("RK_WORKLOAD_HANDLE", handle.value()));
    }

    private String run(List<String> command, Map<String, String> env) throws ProvisionerException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.environment().putAll(env);
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw ProvisionerException.transientFailure("provisioner command spawn failed: " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw ProvisionerException.transientFailure(
                        "provisioner command timeout after " + Duration.ofMillis(timeoutMs), null);
            }
            String combined = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            int exit = process.exitValue();
            if (exit == 0) {
                return combined;
            }
            String message = "provisioner command exit=" + exit + " output=" + truncate(combined);
            if (exit == EXIT_TEMPFAIL) {
                throw ProvisionerException.transientFailure(message, null);
            }
            throw ProvisionerException.rejected(message);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw ProvisionerException.transientFailure("provisioner command interrupted", e);
        } catch (IOException e) {
            process.destroyForcibly();
            throw ProvisionerException.transientFailure("provisioner command I/O failed: " + e.getMessage(), e);
        }
    }

    private static String lastNonBlankLine(String output) {
        String last = "";
        for (String line : output.split("\\R")) {
            if (!line.isBlank()) {
                last = line.strip();
            }
        }
        return last;
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
