package com.example.vidstream.service;

import com.example.vidstream.domain.TranscodeProfile;
import com.example.vidstream.exceptions.FfmpegProcessingException;
import net.bramp.ffmpeg.builder.FFmpegBuilder;

import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;

public interface FfmpegService {

    String PLAYLIST_FILE_NAME = "index.m3u8";
    String SEGMENT_FILE_PATTERN = "%03d.ts";

    /**
     * Builds the HLS VOD command for one profile.
     *
     * @param sourcePath      The source video.
     * @param outputDir       Directory receiving {@code index.m3u8} and the numbered segments.
     * @param profile         Target resolution and bitrates.
     * @param segmentDuration Target segment length.
     * @param logContext      Context information for logging (e.g., job id).
     * @return A configured FFmpegBuilder instance.
     */
    FFmpegBuilder buildHlsCommand(
            Path sourcePath, Path outputDir, TranscodeProfile profile, Duration segmentDuration, String logContext);

    /**
     * Runs the command and waits for it within the configured job timeout.
     *
     * @throws FfmpegProcessingException If the encoder cannot be started or exits with a non-zero code.
     * @throws TimeoutException          If the encoder exceeds the timeout. The process is killed.
     * @throws InterruptedException      If the waiting thread is interrupted. The process is killed.
     */
    void executeFfmpegJob(FFmpegBuilder builder, Long videoId, String logContext)
            throws FfmpegProcessingException, TimeoutException, InterruptedException;

    /**
     * Height of the first video stream of the source, empty when no probe is configured.
     *
     * @throws FfmpegProcessingException if the source cannot be probed or has no video stream
     */
    OptionalInt probeVideoHeight(Path sourcePath) throws FfmpegProcessingException;
}
