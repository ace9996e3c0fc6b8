package com.example.vidstream.service.impl;

import com.example.vidstream.config.TranscodeProperties;
import com.example.vidstream.domain.TranscodeProfile;
import com.example.vidstream.exceptions.FfmpegProcessingException;
import com.example.vidstream.exceptions.ProfileExceedsSourceException;
import com.example.vidstream.exceptions.StreamOutputRetrievalException;
import com.example.vidstream.exceptions.TranscodeException;
import com.example.vidstream.exceptions.VideoStorageException;
import com.example.vidstream.service.EncoderFailureClassifier;
import com.example.vidstream.service.FfmpegService;
import com.example.vidstream.service.HlsPlaylist;
import com.example.vidstream.service.RenditionArtifact;
import com.example.vidstream.service.TranscodeEngine;
import com.example.vidstream.service.VideoStorageService;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;

@Service
public class HlsTranscodeEngine implements TranscodeEngine {

    private static final Logger log = LoggerFactory.getLogger(HlsTranscodeEngine.class);

    private final FfmpegService ffmpegService;
    private final VideoStorageService storageService;
    private final EncoderFailureClassifier failureClassifier;
    private final Duration segmentDuration;

    public HlsTranscodeEngine(FfmpegService ffmpegService,
                              VideoStorageService storageService,
                              EncoderFailureClassifier failureClassifier,
                              TranscodeProperties transcodeProperties) {
        this.ffmpegService = ffmpegService;
        this.storageService = storageService;
        this.failureClassifier = failureClassifier;
        this.segmentDuration = transcodeProperties.segmentDuration();
    }

    @Override
    public RenditionArtifact transcode(Long videoId, Path sourcePath, TranscodeProfile profile, Path outputDir, boolean overwrite)
            throws TranscodeException {
        String logContext = "Engine:" + videoId + "/" + profile.name();
        String logPrefix = "[" + logContext + "]";

        if (!Files.isRegularFile(sourcePath) || !Files.isReadable(sourcePath)) {
            throw new TranscodeException("Source missing or unreadable: " + sourcePath.getFileName(), false);
        }

        if (!overwrite) {
            RenditionArtifact existing = findComplete(outputDir);
            if (existing != null) {
                log.info("{} Complete rendition already present ({} segments), skipping encode", logPrefix, existing.segments().size());
                return existing;
            }
        }

        checkSourceResolution(sourcePath, profile, logPrefix);

        Path stagingDir = createStaging(outputDir);
        boolean published = false;
        try {
            FFmpegBuilder command = ffmpegService.buildHlsCommand(sourcePath, stagingDir, profile, segmentDuration, logContext);
            ffmpegService.executeFfmpegJob(command, videoId, logContext);

            if (findComplete(stagingDir) == null) {
                throw new TranscodeException("Encoder finished but produced an incomplete rendition for " + profile, false);
            }
            storageService.publishStaging(stagingDir, outputDir);
            published = true;

            RenditionArtifact artifact = findComplete(outputDir);
            if (artifact == null) {
                throw new TranscodeException("Published rendition for " + profile + " failed verification", false);
            }
            log.info("{} Encoded {} segments into {}", logPrefix, artifact.segments().size(), outputDir);
            return artifact;

        } catch (FfmpegProcessingException e) {
            boolean retryable = failureClassifier.isRetryable(e);
            log.warn("{} Encoder failed ({}): {}", logPrefix, retryable ? "transient" : "fatal", e.getMessage());
            throw new TranscodeException(e.getMessage(), e, retryable);
        } catch (TimeoutException e) {
            throw new TranscodeException("Encoder timed out: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscodeException("Interrupted while encoding " + profile, e, true);
        } catch (StreamOutputRetrievalException e) {
            throw new TranscodeException("Lost encoder " + e.getStreamName() + ": " + e.getMessage(), e, true);
        } catch (VideoStorageException e) {
            throw new TranscodeException("Storage error: " + e.getMessage(), e, false);
        } finally {
            if (!published) {
                cleanupStaging(stagingDir, logPrefix);
            }
        }
    }

    @Override
    public RenditionArtifact findComplete(Path outputDir) {
        Path playlist = outputDir.resolve(FfmpegService.PLAYLIST_FILE_NAME);
        if (!storageService.isComplete(playlist)) {
            return null;
        }
        HlsPlaylist parsed;
        try {
            parsed = HlsPlaylist.read(playlist);
        } catch (VideoStorageException e) {
            log.warn("Could not read playlist {}: {}", playlist, e.getMessage());
            return null;
        }
        if (!parsed.isComplete()) {
            return null;
        }
        List<Path> segments = new ArrayList<>(parsed.segmentUris().size());
        for (String uri : parsed.segmentUris()) {
            Path segment = outputDir.resolve(uri).normalize();
            if (!segment.startsWith(outputDir) || !storageService.isComplete(segment)) {
                return null;
            }
            segments.add(segment);
        }
        return new RenditionArtifact(playlist, segments);
    }

    private void checkSourceResolution(Path sourcePath, TranscodeProfile profile, String logPrefix) {
        OptionalInt sourceHeight;
        try {
            sourceHeight = ffmpegService.probeVideoHeight(sourcePath);
        } catch (FfmpegProcessingException e) {
            throw new TranscodeException("Source is corrupt or unsupported: " + e.getMessage(), e, false);
        }
        if (sourceHeight.isEmpty()) {
            log.debug("{} No probe available, skipping resolution check", logPrefix);
            return;
        }
        if (profile.height() > sourceHeight.getAsInt()) {
            throw new ProfileExceedsSourceException(profile.name(), profile.height(), sourceHeight.getAsInt());
        }
    }

    private Path createStaging(Path outputDir) {
        try {
            return storageService.createStagingDirectory(outputDir);
        } catch (VideoStorageException e) {
            throw new TranscodeException("Storage error: " + e.getMessage(), e, false);
        }
    }

    private void cleanupStaging(Path stagingDir, String logPrefix) {
        try {
            storageService.deleteRecursively(stagingDir);
        } catch (VideoStorageException e) {
            log.error("{} Failed to remove staging directory {}", logPrefix, stagingDir, e);
        }
    }
}
