package io.rangekeeper.security;

import java.security.SecureRandom;
import java.util.HexFormat;

public final class FlagGenerator {
    public static final String PLACEHOLDER = "<hex>";
    private static final int PLACEHOLDER_BYTES = 3;
    private static final int SUFFIX_BYTES = 16;
    private static final int MAX_TEMPLATE_LENGTH = 256;

    private final SecureRandom secureRandom;
    private final String prefix;
    private final String defaultTemplate;

    public FlagGenerator(String prefix, String defaultTemplate) {
        this(new SecureRandom(), prefix, defaultTemplate);
    }

    public FlagGenerator(SecureRandom secureRandom, String prefix, String defaultTemplate) {
        this.secureRandom = secureRandom;
        this.prefix = prefix == null || prefix.isBlank() ? "FLAG" : prefix.trim();
        this.defaultTemplate = defaultTemplate == null || defaultTemplate.isBlank() ? PLACEHOLDER : defaultTemplate.trim();
        validateTemplate(this.defaultTemplate);
    }

    public FlagSecret mint(String template) {
        String effective = template == null || template.isBlank() ? defaultTemplate : template.trim();
        validateTemplate(effective);
        StringBuilder body = new StringBuilder(effective.length() + SUFFIX_BYTES * 2 + 8);
        int from = 0;
        int at;
        while ((at = effective.indexOf(PLACEHOLDER, from)) >= 0) {
            body.append(effective, from, at).append(randomHex(PLACEHOLDER_BYTES));
            from = at + PLACEHOLDER.length();
        }
        body.append(effective, from, effective.length());
        if (body.length() > 0) {
            body.append('_');
        }
        body.append(randomHex(SUFFIX_BYTES));
        return new FlagSecret(prefix + "{" + body + "}");
    }

    public String prefix() {
        return prefix;
    }

    private String randomHex(int bytes) {
        byte[] raw = new byte[bytes];
        secureRandom.nextBytes(raw);
        return HexFormat.of().formatHex(raw);
    }

    static void validateTemplate(String template) {
        if (template.length() > MAX_TEMPLATE_LENGTH) {
            throw new IllegalArgumentException("flag template longer than " + MAX_TEMPLATE_LENGTH + " characters");
        }
        for (int i = 0; i < template.length(); i++) {
            char ch = template.charAt(i);
            if (ch == '{' || ch == '}' || Character.isISOControl(ch) || Character.isWhitespace(ch)) {
                throw new IllegalArgumentException("flag template contains unsupported character at index " + i);
            }
        }
    }
}
