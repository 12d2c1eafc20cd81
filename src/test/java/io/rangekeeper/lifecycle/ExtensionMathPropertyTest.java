package io.rangekeeper.lifecycle;

import io.rangekeeper.model.Policy;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ExtensionMathPropertyTest {

    @Property(tries = 500)
    void repeatedExtensionNeverPassesCountOrLifetimeLimits(
            @ForAll @LongRange(min = 1, max = 20_000) long baseSeconds,
            @ForAll @LongRange(min = 0, max = 10_000) long incrementSeconds,
            @ForAll @IntRange(min = 0, max = 25) int maxExtensions,
            @ForAll @LongRange(min = 0, max = 100_000) long headroomSeconds,
            @ForAll @LongRange(min = 0, max = 4_000_000_000_000L) long createdAtMs
    ) {
        Policy policy = Policy.ofSeconds(baseSeconds, incrementSeconds, maxExtensions, baseSeconds + headroomSeconds);
        long cap = createdAtMs + policy.maxLifetime().toMillis();
        long expires = createdAtMs + policy.baseRuntime().toMillis();
        int count = 0;

        for (int step = 0; step <= maxExtensions + 1; step++) {
            ExtensionMath.Decision d = ExtensionMath.decide(createdAtMs, expires, count, policy);
            if (d.verdict() != ExtensionMath.Verdict.EXTENDED) {
                Assertions.assertEquals(expires, d.newExpiresAtMs());
                if (count >= maxExtensions) {
                    Assertions.assertEquals(ExtensionMath.Verdict.LIMIT_REACHED, d.verdict());
                } else {
                    Assertions.assertEquals(ExtensionMath.Verdict.CAP_REACHED, d.verdict());
                }
                break;
            }
            Assertions.assertTrue(d.newExpiresAtMs() > expires);
            Assertions.assertTrue(d.newExpiresAtMs() <= cap);
            Assertions.assertEquals(count + 1, d.newExtensionCount());
            Assertions.assertTrue(d.newExtensionCount() <= maxExtensions);
            expires = d.newExpiresAtMs();
            count = d.newExtensionCount();
        }

        Assertions.assertTrue(count <= maxExtensions);
        Assertions.assertTrue(expires <= cap);
    }

    @Property(tries = 200)
    void shrunkenPolicyNeverMovesDeadlineBackwards(
            @ForAll @LongRange(min = 60, max = 3_600) long baseSeconds,
            @ForAll @LongRange(min = 1, max = 100_000) long pastCapMs
    ) {
        Policy policy = Policy.ofSeconds(baseSeconds, 600L, 10, baseSeconds);
        long created = 1_000_000L;
        long expires = created + policy.maxLifetime().toMillis() + pastCapMs;

        ExtensionMath.Decision d = ExtensionMath.decide(created, expires, 0, policy);
        Assertions.assertEquals(ExtensionMath.Verdict.CAP_REACHED, d.verdict());
        Assertions.assertEquals(expires, d.newExpiresAtMs());
    }

    @Test
    void zeroIncrementIsReportedAsCapReached() {
        Policy policy = Policy.ofSeconds(900L, 0L, 3, 5_400L);
        ExtensionMath.Decision d = ExtensionMath.decide(0L, 900_000L, 0, policy);
        Assertions.assertEquals(ExtensionMath.Verdict.CAP_REACHED, d.verdict());
    }

    @Test
    void lastExtensionIsClampedToCap() {
        Policy policy = Policy.ofSeconds(900L, 900L, 5, 2_000L);
        ExtensionMath.Decision d = ExtensionMath.decide(0L, 1_800_000L, 1, policy);
        Assertions.assertEquals(ExtensionMath.Verdict.EXTENDED, d.verdict());
        Assertions.assertEquals(2_000_000L, d.newExpiresAtMs());
        Assertions.assertEquals(2, d.newExtensionCount());
    }
}
