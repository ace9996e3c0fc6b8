package com.example.vidstream.repository;

import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.domain.TranscodeJob.JobStatus;
import org.springframework.data.repository.CrudRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TranscodeJobRepository extends CrudRepository<TranscodeJob, Long> {

    /**
     * Finds the oldest job for a (video, profile) key in one of the given states.
     * Used to coalesce enqueues into an already active job.
     */
    Optional<TranscodeJob> findFirstByVideoIdAndProfileNameAndStatusInOrderByIdAsc(
            Long videoId, String profileName, Collection<JobStatus> statuses);

    /**
     * Dispatch candidates in FIFO order: queued jobs whose backoff gate has passed.
     */
    List<TranscodeJob> findByStatusAndNotBeforeLessThanEqualOrderByIdAsc(JobStatus status, Instant now);

    List<TranscodeJob> findByStatus(JobStatus status);

    /**
     * Running jobs whose lease started before {@code cutoff}.
     */
    List<TranscodeJob> findByStatusAndStartedAtBefore(JobStatus status, Instant cutoff);

    List<TranscodeJob> findByVideoIdOrderByIdDesc(Long videoId);

    boolean existsByVideoIdAndStatusIn(Long videoId, Collection<JobStatus> statuses);
}
