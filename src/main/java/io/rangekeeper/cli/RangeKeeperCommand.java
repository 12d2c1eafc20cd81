package io.rangekeeper.cli;

import io.rangekeeper.audit.AuditQuery;
import io.rangekeeper.audit.AuditVerification;
import io.rangekeeper.config.RangeKeeperConfig;
import io.rangekeeper.lifecycle.CreateRequest;
import io.rangekeeper.model.AuditAction;
import io.rangekeeper.model.Outcome;
import io.rangekeeper.model.Policy;
import io.rangekeeper.model.Requester;
import io.rangekeeper.runtime.RangeKeeperRuntime;
import io.rangekeeper.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "rangekeeper",
        mixinStandardHelpOptions = true,
        description = "RangeKeeper challenge instance and flag runtime CLI",
        subcommands = {
                RangeKeeperCommand.InitCommand.class,
                RangeKeeperCommand.CreateCommand.class,
                RangeKeeperCommand.ExtendCommand.class,
                RangeKeeperCommand.StopCommand.class,
                RangeKeeperCommand.StatusCommand.class,
                RangeKeeperCommand.SubmitFlagCommand.class,
                RangeKeeperCommand.ReapCommand.class,
                RangeKeeperCommand.ServeReaperCommand.class,
                RangeKeeperCommand.KeyStatusCommand.class,
                RangeKeeperCommand.KeyRotateCommand.class,
                RangeKeeperCommand.PolicySetCommand.class,
                RangeKeeperCommand.PolicyListCommand.class,
                RangeKeeperCommand.PolicyRemoveCommand.class,
                RangeKeeperCommand.AuditQueryCommand.class,
                RangeKeeperCommand.AuditVerifyCommand.class,
                RangeKeeperCommand.PurgeCommand.class,
                RangeKeeperCommand.StatsCommand.class,
                RangeKeeperCommand.MetricsCommand.class
        }
)
public final class RangeKeeperCommand implements Runnable {
    static final int EXIT_REJECTED = 2;

    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create | extend | stop | status | submit-flag | reap | serve-reaper | key-status | key-rotate | policy-set | policy-list | policy-remove | audit-query | audit-verify | purge | stats | metrics");
    }

    RangeKeeperRuntime runtime() {
        RangeKeeperRuntime runtime = new RangeKeeperRuntime(RangeKeeperConfig.fromRoot(root, namespace));
        runtime.init();
        return runtime;
    }

    static int print(Outcome<?> outcome) {
        if (outcome.isOk()) {
            System.out.println(Jsons.toJson(outcome.value()));
            return 0;
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", outcome.error().name());
        error.put("retryable", outcome.error().retryable());
        error.put("message", outcome.message());
        System.out.println(Jsons.toJson(error));
        return EXIT_REJECTED;
    }

    static Requester requester(String principal, boolean admin) {
        if (admin) {
            return Requester.admin(principal == null ? "cli" : principal);
        }
        if (principal == null || principal.isBlank()) {
            return Requester.system();
        }
        return Requester.principal(principal);
    }

    static String actor(String by) {
        return by == null || by.isBlank() ? "admin:cli" : "admin:" + by.trim();
    }

    @Command(name = "init", description = "Initialize directories, SQLite schema and keyring")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                System.out.println("Initialized RangeKeeper at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "create", description = "Create an instance for a principal and challenge")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--principal"}, required = true, description = "Owning principal id")
        String principal;

        @Option(names = {"--challenge"}, required = true, description = "Challenge id")
        String challenge;

        @Option(names = {"--flag-template"}, description = "Flag template with <hex> placeholders")
        String flagTemplate;

        @Option(names = {"--attr"}, description = "Provisioner attribute key=value (repeatable)")
        Map<String, String> attributes;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.createInstance(principal, challenge, new CreateRequest(flagTemplate, attributes)));
            }
        }
    }

    @Command(name = "extend", description = "Extend a running instance by one increment")
    static final class ExtendCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--instance"}, required = true, description = "Instance id")
        String instanceId;

        @Option(names = {"--principal"}, description = "Requesting principal id")
        String principal;

        @Option(names = {"--admin"}, description = "Act as administrator")
        boolean admin;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.extendInstance(instanceId, requester(principal, admin)));
            }
        }
    }

    @Command(name = "stop", description = "Stop a running instance and revoke its flag")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--instance"}, required = true, description = "Instance id")
        String instanceId;

        @Option(names = {"--principal"}, description = "Requesting principal id")
        String principal;

        @Option(names = {"--admin"}, description = "Act as administrator")
        boolean admin;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.stopInstance(instanceId, requester(principal, admin)));
            }
        }
    }

    @Command(name = "status", description = "Show an instance, by id or by principal and challenge")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--instance"}, description = "Instance id")
        String instanceId;

        @Option(names = {"--principal"}, description = "Principal id")
        String principal;

        @Option(names = {"--challenge"}, description = "Challenge id (with --principal)")
        String challenge;

        @Option(names = {"--admin"}, description = "Act as administrator")
        boolean admin;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                if (instanceId != null && !instanceId.isBlank()) {
                    return print(runtime.getInstanceStatus(instanceId, requester(principal, admin)));
                }
                if (principal == null || challenge == null) {
                    System.err.println("status needs --instance, or --principal with --challenge");
                    return EXIT_REJECTED;
                }
                return print(runtime.getActiveInstance(principal, challenge));
            }
        }
    }

    @Command(name = "submit-flag", description = "Check a flag submission for an instance")
    static final class SubmitFlagCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--instance"}, required = true, description = "Instance id")
        String instanceId;

        @Option(names = {"--principal"}, required = true, description = "Submitting principal id")
        String principal;

        @Option(names = {"--flag"}, required = true, description = "Submitted flag text")
        String flag;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.submitFlag(instanceId, principal, flag));
            }
        }
    }

    @Command(name = "reap", description = "Run one expiry sweep")
    static final class ReapCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.sweep()));
                return 0;
            }
        }
    }

    @Command(name = "serve-reaper", description = "Run the expiry reaper on its configured interval")
    static final class ServeReaperCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--duration-seconds"}, defaultValue = "0", description = "Stop after this many seconds; 0 runs until interrupted")
        long durationSeconds;

        @Override
        public Integer call() throws Exception {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                CountDownLatch shutdown = new CountDownLatch(1);
                Thread hook = new Thread(shutdown::countDown, "rangekeeper-shutdown");
                Runtime.getRuntime().addShutdownHook(hook);
                runtime.startReaper();
                System.out.println("Reaper running, interval=" + Duration.ofMillis(runtime.settings().reaperIntervalMs()));
                if (durationSeconds > 0) {
                    shutdown.await(durationSeconds, TimeUnit.SECONDS);
                    Runtime.getRuntime().removeShutdownHook(hook);
                } else {
                    shutdown.await();
                }
                runtime.stopReaper();
            }
            return 0;
        }
    }

    @Command(name = "key-status", description = "Show flag keyring status")
    static final class KeyStatusCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.keyStatus());
            }
        }
    }

    @Command(name = "key-rotate", description = "Activate a new flag encryption key")
    static final class KeyRotateCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--by"}, description = "Operator name recorded in the audit trail")
        String by;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.rotateKey(actor(by)));
            }
        }
    }

    @Command(name = "policy-set", description = "Create or replace a challenge policy override")
    static final class PolicySetCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--challenge"}, required = true, description = "Challenge id")
        String challenge;

        @Option(names = {"--base-seconds"}, required = true, description = "Initial runtime in seconds")
        long baseSeconds;

        @Option(names = {"--increment-seconds"}, required = true, description = "Extension increment in seconds")
        long incrementSeconds;

        @Option(names = {"--max-extensions"}, required = true, description = "Maximum number of extensions")
        int maxExtensions;

        @Option(names = {"--max-lifetime-seconds"}, required = true, description = "Hard lifetime cap in seconds")
        long maxLifetimeSeconds;

        @Option(names = {"--by"}, description = "Operator name recorded in the audit trail")
        String by;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.setPolicy(challenge, baseSeconds, incrementSeconds, maxExtensions, maxLifetimeSeconds, actor(by)));
            }
        }
    }

    @Command(name = "policy-list", description = "List challenge policy overrides and the global default")
    static final class PolicyListCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                Outcome<?> overrides = runtime.listPolicies();
                if (!overrides.isOk()) {
                    return print(overrides);
                }
                Map<String, Object> out = new LinkedHashMap<>();
                Policy global = runtime.resolvePolicy(null).value();
                Map<String, Object> defaults = new LinkedHashMap<>();
                defaults.put("baseRuntimeSeconds", global.baseRuntime().toSeconds());
                defaults.put("extensionIncrementSeconds", global.extensionIncrement().toSeconds());
                defaults.put("maxExtensions", global.maxExtensions());
                defaults.put("maxLifetimeSeconds", global.maxLifetime().toSeconds());
                out.put("global_default", defaults);
                out.put("overrides", overrides.value());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "policy-remove", description = "Remove a challenge policy override")
    static final class PolicyRemoveCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--challenge"}, required = true, description = "Challenge id")
        String challenge;

        @Option(names = {"--by"}, description = "Operator name recorded in the audit trail")
        String by;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.removePolicy(challenge, actor(by)));
            }
        }
    }

    @Command(name = "audit-query", description = "Query the audit trail, oldest first")
    static final class AuditQueryCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--principal"}, description = "Filter by principal id")
        String principal;

        @Option(names = {"--challenge"}, description = "Filter by challenge id")
        String challenge;

        @Option(names = {"--instance"}, description = "Filter by instance id")
        String instanceId;

        @Option(names = {"--action"}, description = "Filter by action name, e.g. extended")
        String action;

        @Option(names = {"--from"}, description = "Filter from ISO-8601 timestamp (inclusive)")
        String from;

        @Option(names = {"--to"}, description = "Filter to ISO-8601 timestamp (inclusive)")
        String to;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of matching rows")
        int limit;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                AuditQuery query = new AuditQuery(
                        principal,
                        challenge,
                        instanceId,
                        action == null ? null : AuditAction.fromString(action),
                        from == null ? null : Instant.parse(from).toEpochMilli(),
                        to == null ? null : Instant.parse(to).toEpochMilli(),
                        limit
                );
                return print(runtime.queryAudit(query));
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                Outcome<AuditVerification> out = runtime.verifyAudit();
                int code = print(out);
                return code != 0 ? code : (out.value().ok() ? 0 : 1);
            }
        }
    }

    @Command(name = "purge", description = "Delete terminated and failed instance rows; audit history is kept")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Option(names = {"--older-than-hours"}, defaultValue = "168", description = "Only rows last updated before this age")
        long olderThanHours;

        @Option(names = {"--limit"}, defaultValue = "1000", description = "Max rows per run")
        int limit;

        @Option(names = {"--by"}, description = "Operator name recorded in the audit trail")
        String by;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                return print(runtime.purgeTerminated(Duration.ofHours(olderThanHours), limit, actor(by)));
            }
        }
    }

    @Command(name = "stats", description = "Show runtime counters as JSON")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.stats()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus text metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        RangeKeeperCommand parent;

        @Override
        public Integer call() {
            try (RangeKeeperRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }
}
