package io.rangekeeper.lifecycle;

import io.rangekeeper.model.Policy;

public final class ExtensionMath {
    private ExtensionMath() {
    }

    public static Decision decide(long createdAtMs, long expiresAtMs, int extensionCount, Policy policy) {
        if (extensionCount >= policy.maxExtensions()) {
            return Decision.limitReached(expiresAtMs);
        }
        long cap = createdAtMs + policy.maxLifetime().toMillis();
        long candidate = Math.min(saturatedAdd(expiresAtMs, policy.extensionIncrement().toMillis()), cap);
        // Equal means already at the cap. Lower can only follow a policy shrink; never move a deadline back.
        if (candidate <= expiresAtMs) {
            return Decision.capReached(expiresAtMs);
        }
        return Decision.extended(candidate, extensionCount + 1);
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        return ((a ^ r) & (b ^ r)) < 0 ? Long.MAX_VALUE : r;
    }

    public enum Verdict {
        EXTENDED,
        LIMIT_REACHED,
        CAP_REACHED
    }

    public record Decision(Verdict verdict, long newExpiresAtMs, int newExtensionCount) {
        static Decision extended(long newExpiresAtMs, int newCount) {
            return new Decision(Verdict.EXTENDED, newExpiresAtMs, newCount);
        }

        static Decision limitReached(long expiresAtMs) {
            return new Decision(Verdict.LIMIT_REACHED, expiresAtMs, -1);
        }

        static Decision capReached(long expiresAtMs) {
            return new Decision(Verdict.CAP_REACHED, expiresAtMs, -1);
        }
    }
}
