package io.rangekeeper.provisioner;

import io.rangekeeper.error.ProvisionerException;
import io.rangekeeper.security.FlagSecret;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.Map;

final class CommandProvisionerTest {
    private static final WorkloadSpec SPEC = new WorkloadSpec("i-42", "alice", "web-101",
            new FlagSecret("FLAG{0123456789abcdef}"), 1_700_000_000_000L, Map.of());

    @Test
    void withoutStartCommandInstancesRunWithoutWorkload() throws Exception {
        CommandProvisioner provisioner = new CommandProvisioner(List.of(), List.of(), 5_000L);
        WorkloadHandle handle = provisioner.start(SPEC);
        Assertions.assertEquals("none:i-42", handle.value());
        Assertions.assertDoesNotThrow(() -> provisioner.stop(handle));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void lastOutputLineIsTheHandleAndContextArrivesInEnvironment() throws Exception {
        CommandProvisioner provisioner = new CommandProvisioner(
                List.of("sh", "-c", "echo starting; echo \"ctr-$RK_INSTANCE_ID-$RK_PRINCIPAL_ID-$RK_CHALLENGE_ID\"; test -n \"$RK_FLAG\""),
                List.of("sh", "-c", "test \"$RK_WORKLOAD_HANDLE\" = ctr-i-42-alice-web-101"),
                5_000L
        );
        WorkloadHandle handle = provisioner.start(SPEC);
        Assertions.assertEquals("ctr-i-42-alice-web-101", handle.value());
        Assertions.assertDoesNotThrow(() -> provisioner.stop(handle));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void exitCodesMapToTransientOrRejected() {
        CommandProvisioner tempfail = new CommandProvisioner(List.of("sh", "-c", "exit 75"), List.of(), 5_000L);
        ProvisionerException busy = Assertions.assertThrows(ProvisionerException.class, () -> tempfail.start(SPEC));
        Assertions.assertTrue(busy.isTransient());

        CommandProvisioner failing = new CommandProvisioner(List.of("sh", "-c", "echo no capacity; exit 3"), List.of(), 5_000L);
        ProvisionerException rejected = Assertions.assertThrows(ProvisionerException.class, () -> failing.start(SPEC));
        Assertions.assertFalse(rejected.isTransient());
        Assertions.assertTrue(rejected.getMessage().contains("no capacity"));

        CommandProvisioner silent = new CommandProvisioner(List.of("sh", "-c", "true"), List.of(), 5_000L);
        Assertions.assertThrows(ProvisionerException.class, () -> silent.start(SPEC));
    }
}
