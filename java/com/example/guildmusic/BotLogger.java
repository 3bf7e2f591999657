package com.example.guildmusic;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.Locale;

/**
 * Logging facade for the music bot
 */
public class BotLogger {
    private static final Logger MAIN = LoggerFactory.getLogger("MusicBot");
    private static final Logger AUDIO = LoggerFactory.getLogger("MusicBot.Audio");
    private static final Logger COMMANDS = LoggerFactory.getLogger("MusicBot.Commands");
    private static final Logger STORAGE = LoggerFactory.getLogger("MusicBot.Storage");

    // Messages that should always reach the console, whatever the level
    private static final Marker CONSOLE = MarkerFactory.getMarker("CONSOLE");

    private BotLogger() {
    }

    /**
     * Log a bot status message that will appear in the console
     */
    public static void status(String message) {
        MAIN.info(CONSOLE, message);
    }

    /**
     * Log audio-related events for a guild
     */
    public static void audio(long guildId, String message) {
        MDC.put("guild", String.valueOf(guildId));
        try {
            AUDIO.info(message);
        } finally {
            MDC.remove("guild");
        }
    }

    public static void audioDebug(long guildId, String message) {
        if (!AUDIO.isDebugEnabled()) return;
        MDC.put("guild", String.valueOf(guildId));
        try {
            AUDIO.debug(message);
        } finally {
            MDC.remove("guild");
        }
    }

    public static void audioWarn(long guildId, String message) {
        MDC.put("guild", String.valueOf(guildId));
        try {
            AUDIO.warn(message);
        } finally {
            MDC.remove("guild");
        }
    }

    public static void audioError(long guildId, String message, Throwable throwable) {
        MDC.put("guild", String.valueOf(guildId));
        try {
            AUDIO.error(message, throwable);
        } finally {
            MDC.remove("guild");
        }
    }

    /**
     * Log command execution
     */
    public static void command(String guild, String user, String command, String args) {
        MDC.put("guild", guild);
        MDC.put("user", user);
        MDC.put("command", command);
        try {
            COMMANDS.info("Command executed: {} with args: {}", command, args);
        } finally {
            MDC.remove("guild");
            MDC.remove("user");
            MDC.remove("command");
        }
    }

    /**
     * Log a persistence failure. Storage errors never stop playback, so they only end up here.
     */
    public static void storageError(String message, Throwable throwable) {
        STORAGE.error(message, throwable);
    }

    public static void storage(String message) {
        STORAGE.debug(message);
    }

    public static void debug(String message) {
        MAIN.debug(message);
    }

    public static void info(String message) {
        MAIN.info(message);
    }

    public static void warn(String message) {
        MAIN.warn(message);
    }

    public static void warn(String message, Throwable throwable) {
        MAIN.warn(message, throwable);
    }

    public static void error(String message) {
        MAIN.error(message);
    }

    public static void error(String message, Throwable throwable) {
        MAIN.error(message, throwable);
    }

    /**
     * Maps the config's log level names (clean, info, debug, trace) onto the logback root logger.
     */
    public static void applyLevel(String logLevel) {
        Level level;
        switch (logLevel == null ? BotConfig.LOG_LEVEL_CLEAN : logLevel.toLowerCase(Locale.ROOT)) {
            case BotConfig.LOG_LEVEL_TRACE:
                level = Level.TRACE;
                break;
            case BotConfig.LOG_LEVEL_DEBUG:
                level = Level.DEBUG;
                break;
            case BotConfig.LOG_LEVEL_INFO:
                level = Level.INFO;
                break;
            default:
                level = Level.WARN;
        }

        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(level);
        }
        // The bot's own loggers stay at INFO in clean mode so status lines still show
        Logger bot = LoggerFactory.getLogger("MusicBot");
        if (bot instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) bot).setLevel(level == Level.WARN ? Level.INFO : level);
        }
    }
}
