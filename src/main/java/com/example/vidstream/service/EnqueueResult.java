package com.example.vidstream.service;

import com.example.vidstream.domain.TranscodeJob;

/**
 * Outcome of one enqueue request for a (video, profile) key.
 *
 * @param profileName   the requested profile
 * @param job           the job now responsible for the key, null when skipped
 * @param coalesced     true if the request joined an already queued or running job
 * @param skippedReason why no job was created or joined, null otherwise
 */
public record EnqueueResult(String profileName, TranscodeJob job, boolean coalesced, String skippedReason) {

    public static EnqueueResult created(TranscodeJob job) {
        return new EnqueueResult(job.getProfileName(), job, false, null);
    }

    public static EnqueueResult coalesced(TranscodeJob job) {
        return new EnqueueResult(job.getProfileName(), job, true, null);
    }

    public static EnqueueResult skipped(String profileName, String reason) {
        return new EnqueueResult(profileName, null, false, reason);
    }

    public boolean isSkipped() {
        return job == null;
    }
}
