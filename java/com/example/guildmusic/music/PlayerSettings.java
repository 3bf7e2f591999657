package com.example.guildmusic.music;

import java.time.Duration;

/**
 * Per-player tuning, built from the bot config.
 */
public final class PlayerSettings {
    public static final int DEFAULT_VOLUME = 100;
    public static final int MAX_VOLUME = 200;
    public static final Duration DEFAULT_INACTIVITY_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration MIN_INACTIVITY_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_WATCHDOG_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final int defaultVolume;
    private final int maxQueueSize;
    private final Duration inactivityTimeout;
    private final Duration watchdogInterval;
    private final Duration connectTimeout;

    public PlayerSettings(int defaultVolume, int maxQueueSize, Duration inactivityTimeout,
                          Duration watchdogInterval, Duration connectTimeout) {
        this.defaultVolume = clampVolume(defaultVolume);
        this.maxQueueSize = Math.max(1, maxQueueSize);
        this.inactivityTimeout = inactivityTimeout == null || inactivityTimeout.compareTo(MIN_INACTIVITY_TIMEOUT) < 0
                ? (inactivityTimeout == null ? DEFAULT_INACTIVITY_TIMEOUT : MIN_INACTIVITY_TIMEOUT)
                : inactivityTimeout;
        this.watchdogInterval = watchdogInterval == null || watchdogInterval.isZero() || watchdogInterval.isNegative()
                ? DEFAULT_WATCHDOG_INTERVAL
                : watchdogInterval;
        this.connectTimeout = connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()
                ? DEFAULT_CONNECT_TIMEOUT
                : connectTimeout;
    }

    public static PlayerSettings defaults() {
        return new PlayerSettings(DEFAULT_VOLUME, MusicQueue.DEFAULT_MAX_SIZE, DEFAULT_INACTIVITY_TIMEOUT,
                DEFAULT_WATCHDOG_INTERVAL, DEFAULT_CONNECT_TIMEOUT);
    }

    public static int clampVolume(int percent) {
        return Math.max(0, Math.min(MAX_VOLUME, percent));
    }

    public int getDefaultVolume() {
        return defaultVolume;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public Duration getInactivityTimeout() {
        return inactivityTimeout;
    }

    public Duration getWatchdogInterval() {
        return watchdogInterval;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }
}
