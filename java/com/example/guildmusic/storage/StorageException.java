package com.example.guildmusic.storage;

/**
 * A read or write against the queue/playlist store failed.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
