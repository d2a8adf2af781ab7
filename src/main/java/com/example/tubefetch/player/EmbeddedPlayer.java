package com.example.tubefetch.player;

import java.util.List;

/**
 * One embedded player instance bound to a single video.
 */
public interface EmbeddedPlayer {

    /**
     * The probe was replaced by a newer one before it finished.
     */
    int ERROR_SUPERSEDED = -1;

    /**
     * The player could not be created or loaded.
     */
    int ERROR_START_FAILED = -2;

    /**
     * The page showed the player's own error overlay without a numeric code.
     */
    int ERROR_OVERLAY = -3;

    interface Listener {
        void onStateChange(PlayerState state);

        void onError(int errorCode);
    }

    /**
     * Begins loading and playback. Events are delivered to {@code listener} from a player thread.
     */
    void start(Listener listener);

    /**
     * Quality tiers the player currently offers, highest first. Empty before playback has settled.
     */
    List<String> availableQualityLevels();

    void stop();

    /**
     * Releases every resource held by the player. Safe to call more than once.
     */
    void destroy();
}
