package com.example.vidstream.events;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a new transcode job has been created. Listeners should react after commit only,
 * the job is not visible to other transactions before that.
 */
public class JobEnqueuedEvent extends ApplicationEvent {

    private final Long jobId;
    private final Long videoId;
    private final String profileName;

    public JobEnqueuedEvent(Object source, Long jobId, Long videoId, String profileName) {
        super(source);
        if (jobId == null || videoId == null || profileName == null) {
            throw new IllegalArgumentException("Event details (jobId, videoId, profileName) cannot be null");
        }
        this.jobId = jobId;
        this.videoId = videoId;
        this.profileName = profileName;
    }

    public Long getJobId() {
        return jobId;
    }

    public Long getVideoId() {
        return videoId;
    }

    public String getProfileName() {
        return profileName;
    }
}
