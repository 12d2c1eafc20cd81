package io.rangekeeper.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.rangekeeper.testing.Harness;
import io.rangekeeper.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class RangeKeeperCommandTest {

    @Test
    void instanceLifecycleThroughCommands() throws Exception {
        Path root = Files.createTempDirectory("rangekeeper-test-cli-lifecycle-");
        try {
            Result init = run(root, "init");
            Assertions.assertEquals(0, init.code());
            Assertions.assertTrue(init.out().contains("Initialized RangeKeeper at:"));

            Result created = run(root, "create", "--principal", "alice", "--challenge", "web-101", "--attr", "tier=gold");
            Assertions.assertEquals(0, created.code(), created.out());
            JsonNode view = Jsons.mapper().readTree(created.out());
            String instanceId = view.get("instanceId").asText();
            Assertions.assertEquals("RUNNING", view.get("status").asText());
            Assertions.assertEquals(900L, view.get("remainingSeconds").asLong());

            Result status = run(root, "status", "--principal", "alice", "--challenge", "web-101");
            Assertions.assertEquals(0, status.code());
            Assertions.assertEquals(instanceId, Jsons.mapper().readTree(status.out()).get("instanceId").asText());

            Result foreign = run(root, "status", "--instance", instanceId, "--principal", "bob");
            Assertions.assertEquals(RangeKeeperCommand.EXIT_REJECTED, foreign.code());
            Assertions.assertEquals("NOT_FOUND", Jsons.mapper().readTree(foreign.out()).get("error").asText());

            Result extended = run(root, "extend", "--instance", instanceId, "--principal", "alice");
            Assertions.assertEquals(0, extended.code());
            Assertions.assertEquals(1, Jsons.mapper().readTree(extended.out()).get("extensionCount").asInt());

            Result wrongFlag = run(root, "submit-flag", "--instance", instanceId, "--principal", "alice", "--flag", "FLAG{nope}");
            Assertions.assertEquals(0, wrongFlag.code());
            Assertions.assertTrue(wrongFlag.out().contains("REJECTED"));

            Assertions.assertEquals(0, run(root, "stop", "--instance", instanceId, "--principal", "alice").code());
            Result again = run(root, "stop", "--instance", instanceId, "--principal", "alice");
            Assertions.assertEquals(RangeKeeperCommand.EXIT_REJECTED, again.code());
            JsonNode error = Jsons.mapper().readTree(again.out());
            Assertions.assertEquals("NOT_RUNNING", error.get("error").asText());
            Assertions.assertFalse(error.get("retryable").asBoolean());

            Result verify = run(root, "audit-verify");
            Assertions.assertEquals(0, verify.code());
            Assertions.assertTrue(Jsons.mapper().readTree(verify.out()).get("ok").asBoolean());

            Result audit = run(root, "audit-query", "--instance", instanceId, "--action", "stopped_manual");
            Assertions.assertEquals(0, audit.code());
            Assertions.assertEquals(1, Jsons.mapper().readTree(audit.out()).size());
        } finally {
            Harness.deleteRecursively(root);
        }
    }

    @Test
    void policyCommandsManageOverrides() throws Exception {
        Path root = Files.createTempDirectory("rangekeeper-test-cli-policy-");
        try {
            Result set = run(root, "policy-set", "--challenge", "speedrun",
                    "--base-seconds", "120", "--increment-seconds", "60",
                    "--max-extensions", "1", "--max-lifetime-seconds", "180", "--by", "ops");
            Assertions.assertEquals(0, set.code(), set.out());
            Assertions.assertEquals("admin:ops", Jsons.mapper().readTree(set.out()).get("updatedBy").asText());

            Result bad = run(root, "policy-set", "--challenge", "speedrun",
                    "--base-seconds", "600", "--increment-seconds", "60",
                    "--max-extensions", "1", "--max-lifetime-seconds", "300");
            Assertions.assertEquals(RangeKeeperCommand.EXIT_REJECTED, bad.code());
            Assertions.assertEquals("INVALID_REQUEST", Jsons.mapper().readTree(bad.out()).get("error").asText());

            Result list = run(root, "policy-list");
            Assertions.assertEquals(0, list.code());
            JsonNode listed = Jsons.mapper().readTree(list.out());
            Assertions.assertEquals(900L, listed.get("global_default").get("baseRuntimeSeconds").asLong());
            Assertions.assertEquals(1, listed.get("overrides").size());
            Assertions.assertEquals(120L, listed.get("overrides").get(0).get("baseRuntimeSeconds").asLong());

            Assertions.assertEquals(0, run(root, "policy-remove", "--challenge", "speedrun").code());
            Assertions.assertEquals(0, Jsons.mapper().readTree(run(root, "policy-list").out()).get("overrides").size());
        } finally {
            Harness.deleteRecursively(root);
        }
    }

    @Test
    void keyRotationAndMetrics() throws Exception {
        Path root = Files.createTempDirectory("rangekeeper-test-cli-keys-");
        try {
            Assertions.assertEquals(0, run(root, "key-status").code());
            Result rotated = run(root, "key-rotate", "--by", "ops");
            Assertions.assertEquals(0, rotated.code());
            Assertions.assertEquals("2", rotated.out().trim());

            Result metrics = run(root, "metrics");
            Assertions.assertEquals(0, metrics.code());
            Assertions.assertTrue(metrics.out().contains("rangekeeper_active_key_id{namespace=\"default\"} 2"), metrics.out());
        } finally {
            Harness.deleteRecursively(root);
        }
    }

    @Test
    void missingRequiredOptionIsAUsageError() throws Exception {
        Path root = Files.createTempDirectory("rangekeeper-test-cli-usage-");
        try {
            Result result = run(root, "create", "--principal", "alice");
            Assertions.assertEquals(CommandLine.ExitCode.USAGE, result.code());
        } finally {
            Harness.deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);

        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = new CommandLine(new RangeKeeperCommand()).execute(full);
            capture.flush();
            return new Result(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int code, String out) {
    }
}
