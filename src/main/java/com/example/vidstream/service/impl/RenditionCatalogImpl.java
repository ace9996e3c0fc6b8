package com.example.vidstream.service.impl;

import com.example.vidstream.domain.Rendition;
import com.example.vidstream.domain.TranscodeJob.JobStatus;
import com.example.vidstream.domain.TranscodeProfile;
import com.example.vidstream.domain.TranscodeProfiles;
import com.example.vidstream.exceptions.JobConflictException;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.exceptions.VideoStorageException;
import com.example.vidstream.repository.RenditionRepository;
import com.example.vidstream.repository.TranscodeJobRepository;
import com.example.vidstream.repository.VideoRepository;
import com.example.vidstream.service.KeyedLocks;
import com.example.vidstream.service.RenditionArtifact;
import com.example.vidstream.service.RenditionCatalog;
import com.example.vidstream.service.VideoStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

@Service
public class RenditionCatalogImpl implements RenditionCatalog {

    private static final Logger log = LoggerFactory.getLogger(RenditionCatalogImpl.class);

    private final RenditionRepository renditionRepository;
    private final TranscodeJobRepository jobRepository;
    private final VideoRepository videoRepository;
    private final VideoStorageService storageService;
    private final TranscodeProfiles profiles;
    private final TransactionTemplate transactionTemplate;
    private final KeyedLocks locks;

    public RenditionCatalogImpl(RenditionRepository renditionRepository,
                                TranscodeJobRepository jobRepository,
                                VideoRepository videoRepository,
                                VideoStorageService storageService,
                                TranscodeProfiles profiles,
                                PlatformTransactionManager transactionManager,
                                KeyedLocks locks) {
        this.renditionRepository = renditionRepository;
        this.jobRepository = jobRepository;
        this.videoRepository = videoRepository;
        this.storageService = storageService;
        this.profiles = profiles;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.locks = locks;
    }

    @Override
    public void markPending(Long videoId, TranscodeProfile profile, Long jobId) {
        locks.runWithLock(KeyedLocks.key(videoId, profile.name()), () -> transactionTemplate.executeWithoutResult(status -> {
            Rendition rendition = renditionRepository.findByVideoIdAndProfileName(videoId, profile.name())
                    .orElseGet(() -> new Rendition(videoId, profile.name()));
            if (rendition.isReady()) {
                // keeps streaming until register swaps in the replacement
                log.debug("[Catalog] Rendition {}/{} stays ready while job {} replaces it", videoId, profile, jobId);
                return;
            }
            rendition.setReady(false);
            rendition.setPlaylistPath(null);
            rendition.replaceSegmentPaths(List.of());
            rendition.setJobId(jobId);
            rendition.setUpdatedAt(Instant.now());
            renditionRepository.save(rendition);
            log.debug("[Catalog] Rendition {}/{} pending for job {}", videoId, profile, jobId);
        }));
    }

    @Override
    public Rendition register(Long videoId, TranscodeProfile profile, RenditionArtifact artifact, Long jobId)
            throws VideoStorageException {
        try {
            verify(videoId, profile, artifact);
        } catch (VideoStorageException e) {
            withdraw(videoId, profile);
            throw e;
        }

        String playlistPath = storageService.relativize(artifact.playlist());
        List<String> segmentPaths = new ArrayList<>(artifact.segments().size());
        for (Path segment : artifact.segments()) {
            segmentPaths.add(storageService.relativize(segment));
        }

        return locks.withLock(KeyedLocks.key(videoId, profile.name()), () -> transactionTemplate.execute(status -> {
            Rendition rendition = renditionRepository.findByVideoIdAndProfileName(videoId, profile.name())
                    .orElseGet(() -> new Rendition(videoId, profile.name()));
            rendition.setPlaylistPath(playlistPath);
            rendition.replaceSegmentPaths(segmentPaths);
            rendition.setJobId(jobId);
            rendition.setReady(true);
            rendition.setUpdatedAt(Instant.now());
            Rendition saved = renditionRepository.save(rendition);
            log.info("[Catalog] Registered rendition {}/{} with {} segments (job {})",
                    videoId, profile, segmentPaths.size(), jobId);
            return saved;
        }));
    }

    /**
     * The artifact is already published over the previous files, so a ready row can no longer be trusted.
     */
    private void withdraw(Long videoId, TranscodeProfile profile) {
        locks.runWithLock(KeyedLocks.key(videoId, profile.name()), () -> transactionTemplate.executeWithoutResult(status ->
                renditionRepository.findByVideoIdAndProfileName(videoId, profile.name())
                        .filter(Rendition::isReady)
                        .ifPresent(rendition -> {
                            rendition.setReady(false);
                            rendition.setUpdatedAt(Instant.now());
                            renditionRepository.save(rendition);
                            log.warn("[Catalog] Withdrew rendition {}/{}: files on disk failed verification", videoId, profile);
                        })));
    }

    private void verify(Long videoId, TranscodeProfile profile, RenditionArtifact artifact) {
        if (artifact.segments().isEmpty()) {
            throw new VideoStorageException("Rendition " + videoId + "/" + profile + " has no segments");
        }
        if (!storageService.isComplete(artifact.playlist())) {
            throw new VideoStorageException("Playlist missing or empty for rendition " + videoId + "/" + profile);
        }
        for (Path segment : artifact.segments()) {
            if (!storageService.isComplete(segment)) {
                throw new VideoStorageException("Segment " + segment.getFileName() + " missing or empty for rendition "
                        + videoId + "/" + profile);
            }
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Rendition lookup(Long videoId, String profileName) {
        TranscodeProfile profile = profiles.resolve(profileName);
        return renditionRepository.findByVideoIdAndProfileNameAndReadyTrue(videoId, profile.name())
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Rendition " + profile + " of video " + videoId + " is not available"));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isReady(Long videoId, String profileName) {
        return renditionRepository.findByVideoIdAndProfileNameAndReadyTrue(videoId, profileName).isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public List<TranscodeProfile> list(Long videoId) {
        return renditionRepository.findByVideoIdAndReadyTrue(videoId).stream()
                .map(rendition -> profiles.find(rendition.getProfileName()))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingInt(TranscodeProfile::rank))
                .toList();
    }

    @Override
    public void purge(Long videoId) {
        if (!videoRepository.existsById(videoId)) {
            throw new ResourceNotFoundException("Video not found with ID: " + videoId);
        }
        List<String> keys = profiles.all().stream()
                .map(profile -> KeyedLocks.key(videoId, profile.name()))
                .toList();
        // holding every key of the video keeps enqueue and workers out until the tree is gone
        locks.runWithLocks(keys, () -> {
            if (jobRepository.existsByVideoIdAndStatusIn(videoId, EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING))) {
                throw new JobConflictException("Video " + videoId + " has active transcode jobs; cancel or wait for them first");
            }
            transactionTemplate.executeWithoutResult(status -> {
                List<Rendition> renditions = renditionRepository.findByVideoId(videoId);
                renditionRepository.deleteAll(renditions);
                log.info("[Catalog] Removed {} rendition rows of video {}", renditions.size(), videoId);
            });
            storageService.deleteRenditions(videoId);
        });
    }
}
