package com.example.tubefetch.player;

/**
 * Flags the embedded player is created with.
 */
public record PlayerOptions(
        boolean muted,
        boolean autoplay,
        boolean showControls,
        boolean keyboardEnabled,
        boolean fullscreenAllowed,
        boolean visible
) {

    /**
     * Muted autoplay with every interactive surface disabled and nothing rendered on screen.
     */
    public static PlayerOptions silentProbe() {
        return new PlayerOptions(true, true, false, false, false, false);
    }

    /**
     * Query string for the embed URL.
     */
    public String toEmbedQuery() {
        return "autoplay=" + flag(autoplay)
                + "&mute=" + flag(muted)
                + "&controls=" + flag(showControls)
                + "&disablekb=" + flag(!keyboardEnabled)
                + "&fs=" + flag(fullscreenAllowed)
                + "&enablejsapi=1";
    }

    private static String flag(boolean value) {
        return value ? "1" : "0";
    }
}
