package io.postflow;

import java.util.Locale;

/**
 * The closed set of external social platforms a {@code Schedule} can target.
 *
 * <p>Each constant carries the lowercase tag used in persisted rows and configuration
 * ({@code twitter}, {@code linkedin}, {@code facebook}, {@code instagram}).
 */
public enum Platform {
    TWITTER("twitter"),
    LINKEDIN("linkedin"),
    FACEBOOK("facebook"),
    INSTAGRAM("instagram");

    private final String tag;

    Platform(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a platform from its tag, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the tag names no known platform
     */
    public static Platform fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("platform tag must not be null");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.tag.equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + tag);
    }
}
