package io.rangekeeper.audit;

public record AuditVerification(
        boolean ok,
        int totalRows,
        int checkedRows,
        long brokenAtId,
        String reason,
        String lastHash
) {
}
