package io.rangekeeper.security;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

final class FlagGeneratorPropertyTest {
    private static final Pattern SUFFIX = Pattern.compile(".*[0-9a-f]{32}}$");

    @Property(tries = 300)
    void mintedFlagKeepsTemplateTextAndAddsRandomHex(
            @ForAll @AlphaChars @NumericChars @StringLength(min = 0, max = 24) String literal,
            @ForAll @IntRange(min = 0, max = 4) int placeholders
    ) {
        StringBuilder template = new StringBuilder(literal);
        for (int i = 0; i < placeholders; i++) {
            template.append("_").append(FlagGenerator.PLACEHOLDER);
        }
        FlagGenerator generator = new FlagGenerator("CTF", "<hex>");
        String flag = generator.mint(template.toString()).value();

        Assertions.assertTrue(flag.startsWith("CTF{"), flag);
        Assertions.assertTrue(flag.endsWith("}"), flag);
        Assertions.assertTrue(SUFFIX.matcher(flag).matches(), flag);
        Assertions.assertFalse(flag.contains(FlagGenerator.PLACEHOLDER));
        if (template.length() > 0) {
            Assertions.assertTrue(flag.startsWith("CTF{" + literal), flag);
            // literal, six hex per placeholder with its separator, "_" and the 32-hex suffix
            int expectedBody = literal.length() + placeholders * 7 + 1 + 32;
            Assertions.assertEquals(expectedBody, flag.length() - "CTF{}".length());
        } else {
            Assertions.assertEquals("CTF{".length() + 6 + 1 + 32 + 1, flag.length());
        }
    }

    @Property(tries = 100)
    void templatesWithBracesOrWhitespaceAreRejected(
            @ForAll @AlphaChars @StringLength(min = 1, max = 10) String literal,
            @ForAll @IntRange(min = 0, max = 3) int which
    ) {
        String bad = switch (which) {
            case 0 -> literal + "{";
            case 1 -> "}" + literal;
            case 2 -> literal + " x";
            default -> literal + "\tz";
        };
        FlagGenerator generator = new FlagGenerator("FLAG", "<hex>");
        Assertions.assertThrows(IllegalArgumentException.class, () -> generator.mint(bad));
    }

    @Test
    void consecutiveMintsDiffer() {
        FlagGenerator generator = new FlagGenerator("FLAG", "static");
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            Assertions.assertTrue(seen.add(generator.mint(null).value()));
        }
    }

    @Test
    void overlongTemplateIsRejected() {
        FlagGenerator generator = new FlagGenerator("FLAG", "<hex>");
        Assertions.assertThrows(IllegalArgumentException.class, () -> generator.mint("a".repeat(257)));
    }

    @Test
    void secretNeverPrintsItsValue() {
        FlagSecret secret = new FlagGenerator("FLAG", "<hex>").mint(null);
        Assertions.assertFalse(secret.toString().contains(secret.value()));
        Assertions.assertTrue(secret.redacted().contains("..."));
    }
}
