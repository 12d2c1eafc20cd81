package io.rangekeeper.observability;

import io.rangekeeper.runtime.RangeKeeperRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(RangeKeeperRuntime.StatsOutcome stats) {
        return format(stats, null);
    }

    public static String format(RangeKeeperRuntime.StatsOutcome stats, String namespace) {
        StringBuilder sb = new StringBuilder();
        String ns = namespace == null || namespace.isBlank() ? null : escapeLabel(namespace.trim());
        appendMapGauge(sb, "rangekeeper_instances", "Instances grouped by status", "status", stats.instancesByStatus(), ns);
        appendMapGauge(sb, "rangekeeper_credentials", "Stored credentials grouped by encryption key id", "key_id",
                stats.credentialsByKeyId(), ns);
        appendGauge(sb, "rangekeeper_active_key_id", "Key id used for newly issued credentials", stats.activeKeyId(), ns);
        appendGauge(sb, "rangekeeper_keys_total", "Keys held in the keyring, retired keys included", stats.totalKeys(), ns);
        appendGauge(sb, "rangekeeper_audit_events_total", "Rows in the audit trail", stats.auditEvents(), ns);
        appendGauge(sb, "rangekeeper_audit_write_failures_total", "Audit writes that failed since start", stats.auditWriteFailures(), ns);
        appendGauge(sb, "rangekeeper_reaper_sweeps_total", "Completed reaper sweeps since start", stats.reaperSweeps(), ns);
        appendGauge(sb, "rangekeeper_reaper_expired_total", "Instances expired by the reaper since start", stats.reaperExpired(), ns);
        appendGauge(sb, "rangekeeper_reaper_teardown_failures_total", "Reaper teardowns that failed and were left running",
                stats.reaperTeardownFailures(), ns);
        appendGauge(sb, "rangekeeper_reaper_sweep_errors_total", "Reaper sweeps that aborted with an error", stats.reaperSweepErrors(), ns);
        return sb.toString();
    }

    private static <K> void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<K, Integer> values, String ns) {
        header(sb, metric, help);
        for (Map.Entry<K, Integer> e : values.entrySet()) {
            sb.append(metric).append('{');
            if (ns != null) {
                sb.append("namespace=\"").append(ns).append("\",");
            }
            sb.append(label).append("=\"").append(escapeLabel(String.valueOf(e.getKey()))).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value, String ns) {
        header(sb, metric, help);
        sb.append(metric);
        if (ns != null) {
            sb.append("{namespace=\"").append(ns).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void header(StringBuilder sb, String metric, String help) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
