package com.example.guildmusic;

import com.example.guildmusic.music.MusicQueue;
import com.example.guildmusic.music.PlayerSettings;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

public class BotConfig {
    public static final String DEFAULT_FILE = "config.txt";

    // Logging levels
    public static final String LOG_LEVEL_CLEAN = "clean";     // Only important messages
    public static final String LOG_LEVEL_INFO = "info";       // General information
    public static final String LOG_LEVEL_DEBUG = "debug";     // Detailed debugging info
    public static final String LOG_LEVEL_TRACE = "trace";     // Everything, including lavaplayer internals

    public static final String STORAGE_JSON = "json";
    public static final String STORAGE_MEMORY = "memory";

    private static final String TOKEN_PLACEHOLDER = "BOT_TOKEN_HERE";

    private final Properties properties = new Properties();
    private final File configFile;

    public BotConfig() {
        this(new File(DEFAULT_FILE));
    }

    public BotConfig(File configFile) {
        this.configFile = configFile;
        load();
    }

    private void load() {
        if (!configFile.exists()) {
            createDefaultConfig();
        }
        if (configFile.exists() && configFile.length() < 10_000_000) { // Max 10MB to prevent corrupt files
            try (Reader reader = new InputStreamReader(new FileInputStream(configFile), StandardCharsets.UTF_8)) {
                properties.load(reader);
                BotLogger.debug("Config loaded from " + configFile.getPath());
            } catch (IOException e) {
                BotLogger.error("Error loading config, using defaults: " + e.getMessage());
            }
        } else if (configFile.exists()) {
            // File exists but is too large - likely corrupted
            BotLogger.error("Config file is too large (" + (configFile.length() / 1024 / 1024)
                    + "MB). Creating backup and using defaults.");
            try {
                File backupFile = new File(configFile.getAbsoluteFile().getParentFile(),
                        "config_backup_" + System.currentTimeMillis() + ".txt");
                Files.move(configFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                BotLogger.error("Error creating backup: " + e.getMessage());
            }
            createDefaultConfig();
        }
    }

    private void createDefaultConfig() {
        BotLogger.status("Creating default configuration file " + configFile.getPath());

        StringBuilder sb = new StringBuilder();
        sb.append("# ═══════════════════════════════════════════════════\n");
        sb.append("# Guild Music Bot Configuration File\n");
        sb.append("# ═══════════════════════════════════════════════════\n\n");

        sb.append("# ┌─────────────────────────────────────────────────┐\n");
        sb.append("# │               REQUIRED SETTINGS                 │\n");
        sb.append("# └─────────────────────────────────────────────────┘\n\n");

        sb.append("# Discord Bot Token (Get from https://discord.com/developers/applications)\n");
        sb.append("token = ").append(TOKEN_PLACEHOLDER).append("\n\n");

        sb.append("# Discord Owner ID (Your user ID, right-click your name and Copy ID)\n");
        sb.append("owner = \n\n");

        sb.append("# ┌─────────────────────────────────────────────────┐\n");
        sb.append("# │               GENERAL SETTINGS                  │\n");
        sb.append("# └─────────────────────────────────────────────────┘\n\n");

        sb.append("# Embed color for messages (#RRGGBB)\n");
        sb.append("embed_color = #1DB954\n\n");

        sb.append("# Commands a user may run per minute\n");
        sb.append("rate_limit_commands = 20\n\n");

        sb.append("# ┌─────────────────────────────────────────────────┐\n");
        sb.append("# │               AUDIO SETTINGS                    │\n");
        sb.append("# └─────────────────────────────────────────────────┘\n\n");

        sb.append("# Volume for new players, 0-200\n");
        sb.append("default_volume = 100\n\n");

        sb.append("# Maximum tracks in a guild's queue\n");
        sb.append("max_queue_size = 500\n\n");

        sb.append("# Tracks per page in the queue command\n");
        sb.append("max_queue_display = 10\n\n");

        sb.append("# Seconds without playback before leaving voice (minimum 60)\n");
        sb.append("inactivity_timeout = 300\n\n");

        sb.append("# Seconds to wait for a voice connection\n");
        sb.append("connect_timeout = 10\n\n");

        sb.append("# ┌─────────────────────────────────────────────────┐\n");
        sb.append("# │               EXTRACTION SETTINGS               │\n");
        sb.append("# └─────────────────────────────────────────────────┘\n\n");

        sb.append("# yt-dlp executable (name on PATH or full path)\n");
        sb.append("ytdlp_path = yt-dlp\n\n");

        sb.append("# Optional cookies.txt for age restricted YouTube videos\n");
        sb.append("youtube_cookies_path = \n\n");

        sb.append("# Seconds a single yt-dlp lookup may take\n");
        sb.append("extraction_timeout = 30\n\n");

        sb.append("# ┌─────────────────────────────────────────────────┐\n");
        sb.append("# │               STORAGE SETTINGS                  │\n");
        sb.append("# └─────────────────────────────────────────────────┘\n\n");

        sb.append("# Possible values: json (saved under data_dir), memory (lost on restart)\n");
        sb.append("storage_type = json\n\n");

        sb.append("data_dir = data\n\n");

        sb.append("# ┌─────────────────────────────────────────────────┐\n");
        sb.append("# │               LOGGING SETTINGS                  │\n");
        sb.append("# └─────────────────────────────────────────────────┘\n\n");

        sb.append("# Possible values:\n");
        sb.append("#   clean - Only important messages (connect/disconnect, errors)\n");
        sb.append("#   info  - General information (track loading, queue management)\n");
        sb.append("#   debug - Detailed debugging information\n");
        sb.append("#   trace - Everything, including all internal library events\n");
        sb.append("log_level = clean\n");

        try (FileWriter writer = new FileWriter(configFile, StandardCharsets.UTF_8)) {
            writer.write(sb.toString());
        } catch (IOException e) {
            BotLogger.error("Error creating default config: " + e.getMessage());
        }
    }

    /**
     * @return true when a real token has been filled in
     */
    public boolean hasToken() {
        String token = getToken();
        return token != null && !token.isEmpty() && !TOKEN_PLACEHOLDER.equals(token);
    }

    public String getToken() {
        return properties.getProperty("token", "").trim();
    }

    public String getOwner() {
        return properties.getProperty("owner", "").trim();
    }

    public String getEmbedColor() {
        return properties.getProperty("embed_color", "#1DB954").trim();
    }

    public int getDefaultVolume() {
        return PlayerSettings.clampVolume(getInt("default_volume", PlayerSettings.DEFAULT_VOLUME));
    }

    public int getMaxQueueSize() {
        return Math.max(1, getInt("max_queue_size", MusicQueue.DEFAULT_MAX_SIZE));
    }

    public int getMaxQueueDisplay() {
        return Math.max(1, getInt("max_queue_display", 10));
    }

    public int getInactivityTimeout() {
        return Math.max((int) PlayerSettings.MIN_INACTIVITY_TIMEOUT.getSeconds(), getInt("inactivity_timeout", 300));
    }

    public int getRateLimitCommands() {
        return Math.max(1, getInt("rate_limit_commands", 20));
    }

    public int getConnectTimeout() {
        return Math.max(1, getInt("connect_timeout", 10));
    }

    public int getExtractionTimeout() {
        return Math.max(1, getInt("extraction_timeout", 30));
    }

    public String getStorageType() {
        String type = properties.getProperty("storage_type", STORAGE_JSON).trim().toLowerCase(Locale.ROOT);
        return STORAGE_MEMORY.equals(type) ? STORAGE_MEMORY : STORAGE_JSON;
    }

    public String getDataDir() {
        String dir = properties.getProperty("data_dir", "data").trim();
        return dir.isEmpty() ? "data" : dir;
    }

    public String getYtDlpPath() {
        String path = properties.getProperty("ytdlp_path", "yt-dlp").trim();
        return path.isEmpty() ? "yt-dlp" : path;
    }

    /**
     * @return the cookies file, or null when not configured
     */
    public String getYoutubeCookiesPath() {
        String path = properties.getProperty("youtube_cookies_path", "").trim();
        return path.isEmpty() ? null : path;
    }

    public String getLogLevel() {
        return properties.getProperty("log_level", LOG_LEVEL_CLEAN).trim().toLowerCase(Locale.ROOT);
    }

    public boolean isDebugLogging() {
        String level = getLogLevel();
        return level.equals(LOG_LEVEL_DEBUG) || level.equals(LOG_LEVEL_TRACE);
    }

    public PlayerSettings toPlayerSettings() {
        return new PlayerSettings(getDefaultVolume(), getMaxQueueSize(),
                Duration.ofSeconds(getInactivityTimeout()), PlayerSettings.DEFAULT_WATCHDOG_INTERVAL,
                Duration.ofSeconds(getConnectTimeout()));
    }

    private int getInt(String key, int fallback) {
        try {
            return Integer.parseInt(properties.getProperty(key, String.valueOf(fallback)).trim());
        } catch (NumberFormatException e) {
            return fallback; // Default if parsing fails
        }
    }
}
