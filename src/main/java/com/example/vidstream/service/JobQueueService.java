package com.example.vidstream.service;

import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.exceptions.InvalidProfileException;
import com.example.vidstream.exceptions.JobConflictException;
import com.example.vidstream.exceptions.ResourceNotFoundException;

import java.util.List;

/**
 * Entry point for requesting transcodes. Used by both the HTTP API and the command line trigger.
 */
public interface JobQueueService {

    /**
     * Requests the rendition of one (video, profile) key. Returns once the job is durably recorded.
     *
     * @throws ResourceNotFoundException if the video does not exist
     * @throws InvalidProfileException   if the profile is not configured
     * @throws JobConflictException      if the key cannot accept the request in its current state
     */
    EnqueueResult enqueue(Long videoId, String profileName, boolean overwrite);

    /**
     * Enqueues every configured profile in ladder order. Conflicting keys are reported as skipped.
     */
    List<EnqueueResult> enqueueAll(Long videoId, boolean overwrite);

    TranscodeJob status(Long jobId);

    /**
     * Jobs of a video, newest first.
     */
    List<TranscodeJob> jobsForVideo(Long videoId);

    /**
     * Cancels a job that has not started yet.
     *
     * @throws JobConflictException if the job is running or already finished
     */
    TranscodeJob cancel(Long jobId);
}
