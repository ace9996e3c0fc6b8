package com.example.vidstream.exceptions;

/**
 * I/O failure reading or writing source files or rendition artifacts.
 * Always fatal for the job that hits it.
 */
public class VideoStorageException extends RuntimeException {
    public VideoStorageException(String message) {
        super(message);
    }

    public VideoStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
