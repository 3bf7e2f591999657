package com.example.guildmusic.music;

import java.util.Locale;

public enum LoopMode {
    OFF("off"),
    // repeat the current track
    ONE("one"),
    // wrap around to the start of the queue
    ALL("all");

    private final String value;

    LoopMode(String value) {
        this.value = value;
    }

    /**
     * Value used in persisted queue state.
     */
    public String getValue() {
        return value;
    }

    public static LoopMode fromValue(String value) {
        if (value == null) {
            return OFF;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LoopMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        return OFF;
    }
}
