package com.example.vidstream.service;

import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.exceptions.JobConflictException;
import com.example.vidstream.exceptions.ResourceNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Job state transitions. Every method commits in its own transaction before returning.
 */
public interface JobStatusUpdater {

    /**
     * Creates a QUEUED job for the key or joins the active one.
     *
     * @throws JobConflictException if an overwrite hits a running job, or a ready rendition exists and overwrite is off
     */
    EnqueueResult enqueueOrCoalesce(Long videoId, String profileName, boolean overwrite);

    /**
     * Moves the oldest eligible QUEUED job to RUNNING and starts its lease.
     * Jobs whose key already has a RUNNING job are passed over.
     */
    Optional<TranscodeJob> claimNext(Instant now);

    void markSucceeded(Long jobId);

    /**
     * Requeues the job with backoff if the failure is retryable and attempts remain, otherwise fails it.
     *
     * @return the job after the transition
     */
    TranscodeJob recordFailure(Long jobId, String error, boolean retryable);

    /**
     * Hands a claimed job back to the queue without counting the attempt.
     */
    void release(Long jobId, String reason);

    /**
     * @throws ResourceNotFoundException if the job does not exist
     * @throws JobConflictException      if the job is not QUEUED
     */
    TranscodeJob cancel(Long jobId);

    /**
     * Requeues RUNNING jobs whose lease started before {@code cutoff}, except those listed in {@code inFlight}.
     * A job whose expired lease was its last allowed attempt is marked FAILED instead.
     *
     * @return the requeued jobs
     */
    List<TranscodeJob> requeueExpiredLeases(Instant cutoff, Set<Long> inFlight);
}
