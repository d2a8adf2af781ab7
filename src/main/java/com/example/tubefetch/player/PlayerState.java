package com.example.tubefetch.player;

/**
 * Playback states reported by the embedded player, with the numeric codes of its JavaScript API.
 */
public enum PlayerState {
    UNSTARTED(-1),
    ENDED(0),
    PLAYING(1),
    PAUSED(2),
    BUFFERING(3),
    CUED(5);

    private final int code;

    PlayerState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the state for {@code code}, or {@link #UNSTARTED} for codes the player API does not define.
     */
    public static PlayerState fromCode(int code) {
        for (PlayerState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        return UNSTARTED;
    }
}
