package com.example.vidstream.service;

import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.domain.TranscodeProfile;
import com.example.vidstream.domain.TranscodeProfiles;
import com.example.vidstream.domain.Video;
import com.example.vidstream.exceptions.TranscodeException;
import com.example.vidstream.exceptions.VideoStorageException;
import com.example.vidstream.repository.VideoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Runs one claimed job to completion: marks the catalog entry pending, encodes, registers and records the outcome.
 * Never throws; every failure ends up on the job.
 */
@Component
public class TranscodeWorker {

    private static final Logger log = LoggerFactory.getLogger(TranscodeWorker.class);

    private final VideoRepository videoRepository;
    private final TranscodeProfiles profiles;
    private final VideoStorageService storageService;
    private final TranscodeEngine engine;
    private final RenditionCatalog catalog;
    private final JobStatusUpdater statusUpdater;

    public TranscodeWorker(VideoRepository videoRepository,
                           TranscodeProfiles profiles,
                           VideoStorageService storageService,
                           TranscodeEngine engine,
                           RenditionCatalog catalog,
                           JobStatusUpdater statusUpdater) {
        this.videoRepository = videoRepository;
        this.profiles = profiles;
        this.storageService = storageService;
        this.engine = engine;
        this.catalog = catalog;
        this.statusUpdater = statusUpdater;
    }

    public void process(TranscodeJob job) {
        String logPrefix = "[Worker][Job:" + job.getId() + "]";
        log.info("{} Starting {} (attempt {}, overwrite={})", logPrefix, job.key(), job.getAttempts(), job.isOverwrite());

        Optional<Video> video = videoRepository.findById(job.getVideoId());
        if (video.isEmpty()) {
            fail(job, "Video " + job.getVideoId() + " no longer exists", false, logPrefix);
            return;
        }
        Optional<TranscodeProfile> profile = profiles.find(job.getProfileName());
        if (profile.isEmpty()) {
            fail(job, "Profile " + job.getProfileName() + " is no longer configured", false, logPrefix);
            return;
        }

        try {
            catalog.markPending(job.getVideoId(), profile.get(), job.getId());

            Path source = storageService.resolveSource(video.get().getSourcePath());
            Path outputDir = storageService.renditionDirectory(job.getVideoId(), profile.get().name());
            RenditionArtifact artifact = engine.transcode(job.getVideoId(), source, profile.get(), outputDir, job.isOverwrite());

            catalog.register(job.getVideoId(), profile.get(), artifact, job.getId());
            statusUpdater.markSucceeded(job.getId());
            log.info("{} Finished {} with {} segments", logPrefix, job.key(), artifact.segments().size());

        } catch (TranscodeException e) {
            fail(job, e.getMessage(), e.isRetryable(), logPrefix);
        } catch (VideoStorageException e) {
            fail(job, "Storage error: " + e.getMessage(), false, logPrefix);
        } catch (RuntimeException e) {
            log.error("{} Unexpected error processing {}", logPrefix, job.key(), e);
            fail(job, "Unexpected error: " + e.getMessage(), false, logPrefix);
        }
    }

    private void fail(TranscodeJob job, String error, boolean retryable, String logPrefix) {
        log.warn("{} {} failed ({}): {}", logPrefix, job.key(), retryable ? "transient" : "fatal", error);
        try {
            statusUpdater.recordFailure(job.getId(), error, retryable);
        } catch (RuntimeException e) {
            // the lease sweep picks the job up again
            log.error("{} CRITICAL: Failed to record failure of job {}", logPrefix, job.getId(), e);
        }
    }
}
