package io.agentloom.sandbox;

/**
 * Strips control characters left in container output. Newlines, tabs and any
 * printable character (including non-ASCII text) are kept.
 */
final class LogSanitizer {
    private LogSanitizer() {
    }

    static String clean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(raw.length());
        raw.codePoints().forEach(cp -> {
            if (cp == '\n' || cp == '\t' || !Character.isISOControl(cp)) {
                out.appendCodePoint(cp);
            }
        });
        return out.toString();
    }
}
