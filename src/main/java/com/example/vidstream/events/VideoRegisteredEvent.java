package com.example.vidstream.events;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a source video has been registered. The video row is only visible to other
 * transactions after commit, so listeners should react in the AFTER_COMMIT phase.
 */
public class VideoRegisteredEvent extends ApplicationEvent {

    private final Long videoId;
    private final String sourcePath;

    public VideoRegisteredEvent(Object source, Long videoId, String sourcePath) {
        super(source);
        if (videoId == null || sourcePath == null) {
            throw new IllegalArgumentException("Event details (videoId, sourcePath) cannot be null");
        }
        this.videoId = videoId;
        this.sourcePath = sourcePath;
    }

    public Long getVideoId() {
        return videoId;
    }

    public String getSourcePath() {
        return sourcePath;
    }
}
