package io.agentloom.sandbox;

/**
 * Splits an image reference into repository and tag. References without a tag or
 * digest resolve to {@code latest}.
 */
public record ImageReference(String repository, String tag, String digest) {
    public static final String DEFAULT_TAG = "latest";

    public static ImageReference parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("image reference cannot be empty");
        }
        String value = raw.trim();
        int at = value.indexOf('@');
        if (at >= 0) {
            return new ImageReference(value.substring(0, at), null, value.substring(at + 1));
        }
        int lastSlash = value.lastIndexOf('/');
        int colon = value.lastIndexOf(':');
        // a colon before the last slash belongs to a registry port
        if (colon > lastSlash) {
            return new ImageReference(value.substring(0, colon), value.substring(colon + 1), null);
        }
        return new ImageReference(value, DEFAULT_TAG, null);
    }

    public String canonical() {
        if (digest != null) {
            return repository + "@" + digest;
        }
        return repository + ":" + tag;
    }
}
