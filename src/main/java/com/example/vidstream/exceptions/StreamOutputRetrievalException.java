package com.example.vidstream.exceptions;

/**
 * Custom RuntimeException indicating an unexpected failure occurred while
 * attempting to retrieve the output from an asynchronous stream reading task (Future).
 * This typically wraps an unexpected exception from Future.get().
 */
public class StreamOutputRetrievalException extends RuntimeException {

    private final String streamName;

    /**
     * Constructs a new StreamOutputRetrievalException.
     *
     * @param message    The detail message.
     * @param streamName The name of the encoder stream being drained ("STDOUT" or "STDERR").
     * @param cause      The original cause of the exception.
     */
    public StreamOutputRetrievalException(String message, String streamName, Throwable cause) {
        super(message, cause);
        this.streamName = streamName;
    }

    public String getStreamName() {
        return streamName;
    }
}
