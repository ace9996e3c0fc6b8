package com.example.vidstream.web.dto;

import com.example.vidstream.domain.TranscodeJob.JobStatus;
import com.example.vidstream.service.EnqueueResult;

import java.util.List;

/**
 * Response of an enqueue request: one entry per profile, either a job that now covers it or the reason it was skipped.
 */
public record EnqueueTranscodeResponse(
        Long videoId,
        List<QueuedJob> jobs,
        List<SkippedProfile> skipped
) {

    public record QueuedJob(Long jobId, String profile, JobStatus status, boolean coalesced) {}

    public record SkippedProfile(String profile, String reason) {}

    public static EnqueueTranscodeResponse fromResults(Long videoId, List<EnqueueResult> results) {
        List<QueuedJob> jobs = results.stream()
                .filter(result -> !result.isSkipped())
                .map(result -> new QueuedJob(result.job().getId(), result.profileName(),
                        result.job().getStatus(), result.coalesced()))
                .toList();
        List<SkippedProfile> skipped = results.stream()
                .filter(EnqueueResult::isSkipped)
                .map(result -> new SkippedProfile(result.profileName(), result.skippedReason()))
                .toList();
        return new EnqueueTranscodeResponse(videoId, jobs, skipped);
    }
}
