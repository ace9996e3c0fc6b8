package com.example.vidstream.service.impl;

import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.domain.TranscodeProfile;
import com.example.vidstream.domain.TranscodeProfiles;
import com.example.vidstream.exceptions.JobConflictException;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.repository.TranscodeJobRepository;
import com.example.vidstream.repository.VideoRepository;
import com.example.vidstream.service.EnqueueResult;
import com.example.vidstream.service.JobQueueService;
import com.example.vidstream.service.JobStatusUpdater;
import com.example.vidstream.service.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
public class JobQueueServiceImpl implements JobQueueService {

    private static final Logger log = LoggerFactory.getLogger(JobQueueServiceImpl.class);

    private static final int MAX_COALESCE_ATTEMPTS = 3;

    private final JobStatusUpdater statusUpdater;
    private final TranscodeJobRepository jobRepository;
    private final VideoRepository videoRepository;
    private final TranscodeProfiles profiles;
    private final KeyedLocks locks;

    public JobQueueServiceImpl(JobStatusUpdater statusUpdater,
                               TranscodeJobRepository jobRepository,
                               VideoRepository videoRepository,
                               TranscodeProfiles profiles,
                               KeyedLocks locks) {
        this.statusUpdater = statusUpdater;
        this.jobRepository = jobRepository;
        this.videoRepository = videoRepository;
        this.profiles = profiles;
        this.locks = locks;
    }

    @Override
    public EnqueueResult enqueue(Long videoId, String profileName, boolean overwrite) {
        requireVideo(videoId);
        TranscodeProfile profile = profiles.resolve(profileName);
        return enqueueKey(videoId, profile, overwrite);
    }

    @Override
    public List<EnqueueResult> enqueueAll(Long videoId, boolean overwrite) {
        requireVideo(videoId);
        List<EnqueueResult> results = new ArrayList<>();
        for (TranscodeProfile profile : profiles.all()) {
            try {
                results.add(enqueueKey(videoId, profile, overwrite));
            } catch (JobConflictException e) {
                log.info("[JobQueue] Skipping {}/{}: {}", videoId, profile, e.getMessage());
                results.add(EnqueueResult.skipped(profile.name(), e.getMessage()));
            }
        }
        return results;
    }

    private EnqueueResult enqueueKey(Long videoId, TranscodeProfile profile, boolean overwrite) {
        // the job is committed by the updater before the lock is released
        return locks.withLock(KeyedLocks.key(videoId, profile.name()), () -> {
            for (int attempt = 1; ; attempt++) {
                try {
                    return statusUpdater.enqueueOrCoalesce(videoId, profile.name(), overwrite);
                } catch (OptimisticLockingFailureException e) {
                    // the queued job was claimed while we raised its overwrite flag, re-read its state
                    if (attempt >= MAX_COALESCE_ATTEMPTS) {
                        throw new JobConflictException("Job for " + KeyedLocks.key(videoId, profile.name())
                                + " changed concurrently, try again");
                    }
                    log.debug("[JobQueue] Concurrent update on {}/{}, retrying", videoId, profile);
                }
            }
        });
    }

    @Override
    @Transactional(readOnly = true)
    public TranscodeJob status(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Transcode job not found with ID: " + jobId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TranscodeJob> jobsForVideo(Long videoId) {
        requireVideo(videoId);
        return jobRepository.findByVideoIdOrderByIdDesc(videoId);
    }

    @Override
    public TranscodeJob cancel(Long jobId) {
        try {
            return statusUpdater.cancel(jobId);
        } catch (OptimisticLockingFailureException e) {
            log.warn("[JobQueue] Job {} changed while cancelling: {}", jobId, e.getMessage());
            throw new JobConflictException("Job " + jobId + " was picked up concurrently and can no longer be cancelled", jobId);
        }
    }

    private void requireVideo(Long videoId) {
        if (videoId == null || !videoRepository.existsById(videoId)) {
            throw new ResourceNotFoundException("Video not found with ID: " + videoId);
        }
    }
}
