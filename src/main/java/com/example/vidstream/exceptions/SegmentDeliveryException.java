package com.example.vidstream.exceptions;

/**
 * A file of a rendition registered as ready could not be read. This is a storage integrity problem,
 * reported as a server error and never as not-found.
 */
public class SegmentDeliveryException extends RuntimeException {
    public SegmentDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
