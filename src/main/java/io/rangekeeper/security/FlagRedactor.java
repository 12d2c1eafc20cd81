package io.rangekeeper.security;

public final class FlagRedactor {
    private static final int KEEP = 3;

    private FlagRedactor() {
    }

    public static String redact(String flag) {
        if (flag == null || flag.isEmpty()) {
            return "";
        }
        int open = flag.indexOf('{');
        boolean wrapped = open >= 0 && flag.endsWith("}");
        String prefix = wrapped ? flag.substring(0, open) : "";
        String body = wrapped ? flag.substring(open + 1, flag.length() - 1) : flag;
        if (body.length() <= KEEP * 2 + 2) {
            return wrapped ? prefix + "{***}" : "***";
        }
        String masked = body.substring(0, KEEP) + "..." + body.substring(body.length() - KEEP);
        return wrapped ? prefix + "{" + masked + "}" : masked;
    }
}
