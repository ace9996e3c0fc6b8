package com.example.vidstream.service.impl;

import com.example.vidstream.config.TranscodeProperties;
import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.domain.TranscodeJob.JobStatus;
import com.example.vidstream.events.JobEnqueuedEvent;
import com.example.vidstream.exceptions.JobConflictException;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.repository.RenditionRepository;
import com.example.vidstream.repository.TranscodeJobRepository;
import com.example.vidstream.service.EnqueueResult;
import com.example.vidstream.service.JobStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class JobStatusUpdaterImpl implements JobStatusUpdater {

    private static final Logger log = LoggerFactory.getLogger(JobStatusUpdaterImpl.class);

    private static final EnumSet<JobStatus> ACTIVE_STATUSES = EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING);
    private static final int MAX_ERROR_LENGTH = 2000;
    static final String LEASE_EXPIRED = "lease expired";

    private final TranscodeJobRepository jobRepository;
    private final RenditionRepository renditionRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final TranscodeProperties properties;

    public JobStatusUpdaterImpl(TranscodeJobRepository jobRepository,
                                RenditionRepository renditionRepository,
                                ApplicationEventPublisher eventPublisher,
                                TranscodeProperties properties) {
        this.jobRepository = jobRepository;
        this.renditionRepository = renditionRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EnqueueResult enqueueOrCoalesce(Long videoId, String profileName, boolean overwrite) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        Optional<TranscodeJob> active = jobRepository
                .findFirstByVideoIdAndProfileNameAndStatusInOrderByIdAsc(videoId, profileName, ACTIVE_STATUSES);

        if (active.isPresent()) {
            TranscodeJob existing = active.get();
            if (!overwrite) {
                log.info("[StatusUpdater][TX:{}] Coalesced request for {}/{} into job {} ({})",
                        txName, videoId, profileName, existing.getId(), existing.getStatus());
                return EnqueueResult.coalesced(existing);
            }
            if (existing.getStatus() == JobStatus.RUNNING) {
                log.warn("[StatusUpdater][TX:{}] Overwrite of {}/{} refused, job {} is running",
                        txName, videoId, profileName, existing.getId());
                throw new JobConflictException("A transcode of " + profileName + " for video " + videoId
                        + " is already running; overwrite it once it has finished", existing.getId());
            }
            if (!existing.isOverwrite()) {
                existing.setOverwrite(true);
                jobRepository.save(existing);
            }
            log.info("[StatusUpdater][TX:{}] Coalesced overwrite request for {}/{} into queued job {}",
                    txName, videoId, profileName, existing.getId());
            return EnqueueResult.coalesced(existing);
        }

        if (!overwrite && renditionRepository.findByVideoIdAndProfileNameAndReadyTrue(videoId, profileName).isPresent()) {
            throw new JobConflictException("Rendition " + profileName + " of video " + videoId
                    + " is already transcoded; request an overwrite to replace it");
        }

        TranscodeJob job = jobRepository.save(new TranscodeJob(videoId, profileName, overwrite, Instant.now()));
        log.info("[StatusUpdater][TX:{}] Created job {} for {}/{} (overwrite={})",
                txName, job.getId(), videoId, profileName, overwrite);
        eventPublisher.publishEvent(new JobEnqueuedEvent(this, job.getId(), videoId, profileName));
        return EnqueueResult.created(job);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<TranscodeJob> claimNext(Instant now) {
        List<TranscodeJob> candidates = jobRepository.findByStatusAndNotBeforeLessThanEqualOrderByIdAsc(JobStatus.QUEUED, now);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Set<String> busyKeys = new HashSet<>();
        jobRepository.findByStatus(JobStatus.RUNNING).forEach(running -> busyKeys.add(running.key()));

        for (TranscodeJob candidate : candidates) {
            if (!busyKeys.add(candidate.key())) {
                continue;
            }
            candidate.setStatus(JobStatus.RUNNING);
            candidate.setStartedAt(now);
            candidate.setAttempts(candidate.getAttempts() + 1);
            TranscodeJob claimed = jobRepository.save(candidate);
            log.info("[StatusUpdater] Claimed job {} for {} (attempt {})", claimed.getId(), claimed.key(), claimed.getAttempts());
            return Optional.of(claimed);
        }
        return Optional.empty();
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markSucceeded(Long jobId) {
        TranscodeJob job = findJob(jobId);
        if (job.getStatus() != JobStatus.RUNNING) {
            log.warn("[StatusUpdater] Job {} finished but is {} (expected RUNNING). Not modifying status.", jobId, job.getStatus());
            return;
        }
        job.setStatus(JobStatus.SUCCEEDED);
        job.setFinishedAt(Instant.now());
        jobRepository.save(job);
        log.info("[StatusUpdater] Job {} for {} SUCCEEDED after {} attempt(s)", jobId, job.key(), job.getAttempts());
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TranscodeJob recordFailure(Long jobId, String error, boolean retryable) {
        TranscodeJob job = findJob(jobId);
        if (job.getStatus() != JobStatus.RUNNING) {
            log.warn("[StatusUpdater] Failure reported for job {} in state {}. Not modifying status.", jobId, job.getStatus());
            return job;
        }
        job.setLastError(truncate(error));

        if (retryable && job.getAttempts() < properties.maxAttempts()) {
            Duration delay = backoff(job.getAttempts());
            job.setStatus(JobStatus.QUEUED);
            job.setNotBefore(Instant.now().plus(delay));
            log.warn("[StatusUpdater] Job {} for {} failed transiently (attempt {}/{}), retrying in {}: {}",
                    jobId, job.key(), job.getAttempts(), properties.maxAttempts(), delay, error);
        } else {
            job.setStatus(JobStatus.FAILED);
            job.setFinishedAt(Instant.now());
            log.error("[StatusUpdater] Job {} for {} FAILED after {} attempt(s): {}",
                    jobId, job.key(), job.getAttempts(), error);
        }
        return jobRepository.save(job);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void release(Long jobId, String reason) {
        TranscodeJob job = findJob(jobId);
        if (job.getStatus() != JobStatus.RUNNING) {
            return;
        }
        job.setStatus(JobStatus.QUEUED);
        job.setAttempts(Math.max(0, job.getAttempts() - 1));
        job.setStartedAt(null);
        job.setNotBefore(Instant.now());
        job.setLastError(truncate(reason));
        jobRepository.save(job);
        log.warn("[StatusUpdater] Job {} released back to the queue: {}", jobId, reason);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TranscodeJob cancel(Long jobId) {
        TranscodeJob job = findJob(jobId);
        if (job.getStatus() != JobStatus.QUEUED) {
            throw new JobConflictException("Job " + jobId + " cannot be cancelled in state " + job.getStatus(), jobId);
        }
        job.setStatus(JobStatus.CANCELLED);
        job.setFinishedAt(Instant.now());
        log.info("[StatusUpdater] Job {} for {} CANCELLED", jobId, job.key());
        return jobRepository.save(job);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<TranscodeJob> requeueExpiredLeases(Instant cutoff, Set<Long> inFlight) {
        List<TranscodeJob> requeued = new ArrayList<>();
        for (TranscodeJob job : jobRepository.findByStatusAndStartedAtBefore(JobStatus.RUNNING, cutoff)) {
            if (inFlight.contains(job.getId())) {
                continue;
            }
            job.setLastError(LEASE_EXPIRED);
            if (job.getAttempts() >= properties.maxAttempts()) {
                job.setStatus(JobStatus.FAILED);
                job.setFinishedAt(Instant.now());
                jobRepository.save(job);
                log.error("[StatusUpdater] Lease of job {} for {} expired on its last attempt ({}/{}), FAILED",
                        job.getId(), job.key(), job.getAttempts(), properties.maxAttempts());
                continue;
            }
            job.setStatus(JobStatus.QUEUED);
            job.setNotBefore(Instant.now());
            requeued.add(jobRepository.save(job));
            log.warn("[StatusUpdater] Lease of job {} for {} expired (started {}), requeued", job.getId(), job.key(), job.getStartedAt());
        }
        return requeued;
    }

    Duration backoff(int attempts) {
        int exponent = Math.min(Math.max(attempts - 1, 0), 20);
        Duration delay = properties.backoffBase().multipliedBy(1L << exponent);
        return delay.compareTo(properties.backoffMax()) > 0 ? properties.backoffMax() : delay;
    }

    private TranscodeJob findJob(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Transcode job not found with ID: " + jobId));
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
