package com.example.vidstream.web.dto;

import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.domain.TranscodeJob.JobStatus;

import java.time.Instant;

/**
 * Client view of a transcode job.
 */
public record JobStatusResponse(
        Long jobId,
        Long videoId,
        String profile,
        JobStatus status,
        boolean overwrite,
        int attempts,
        String lastError,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Instant notBefore
) {

    public static JobStatusResponse fromEntity(TranscodeJob job) {
        if (job == null) {
            throw new NullPointerException("Cannot create JobStatusResponse from null TranscodeJob entity");
        }
        return new JobStatusResponse(
                job.getId(),
                job.getVideoId(),
                job.getProfileName(),
                job.getStatus(),
                job.isOverwrite(),
                job.getAttempts(),
                job.getLastError(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getFinishedAt(),
                job.getNotBefore()
        );
    }
}
