package com.example.vidstream.service.impl;

import com.example.vidstream.config.AsyncConfig;
import com.example.vidstream.config.TranscodeProperties;
import com.example.vidstream.domain.TranscodeProfile;
import com.example.vidstream.exceptions.FfmpegProcessingException;
import com.example.vidstream.exceptions.StreamOutputRetrievalException;
import com.example.vidstream.service.FfmpegService;
import net.bramp.ffmpeg.FFmpeg;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import net.bramp.ffmpeg.builder.FFmpegOutputBuilder;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import net.bramp.ffmpeg.probe.FFmpegStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class FfmpegServiceImpl implements FfmpegService {

    private static final Logger log = LoggerFactory.getLogger(FfmpegServiceImpl.class);

    private static final int STDERR_TAIL_CHARS = 4000;
    private static final long STREAM_DRAIN_TIMEOUT_SECONDS = 10;

    private final String ffmpegPath;
    private final ObjectProvider<FFprobe> ffprobeProvider;
    private final AsyncTaskExecutor streamExecutor;
    private final Duration jobTimeout;

    public FfmpegServiceImpl(
            @Value("${ffmpeg.path:ffmpeg}") String ffmpegPath,
            ObjectProvider<FFprobe> ffprobeProvider,
            @Qualifier(AsyncConfig.ENCODER_STREAM_EXECUTOR) AsyncTaskExecutor streamExecutor,
            TranscodeProperties transcodeProperties
    ) {
        this.ffmpegPath = ffmpegPath;
        this.ffprobeProvider = ffprobeProvider;
        this.streamExecutor = streamExecutor;
        this.jobTimeout = transcodeProperties.jobTimeout();
    }

    @Override
    public FFmpegBuilder buildHlsCommand(
            Path sourcePath, Path outputDir, TranscodeProfile profile, Duration segmentDuration, String logContext) {
        String logPrefix = logPrefix(logContext);
        log.debug("{} Building HLS command for profile {} from {}", logPrefix, profile, sourcePath);

        FFmpegBuilder builder = new FFmpegBuilder()
                .setVerbosity(FFmpegBuilder.Verbosity.ERROR)
                .overrideOutputFiles(true)
                .addExtraArgs("-nostdin")
                .addInput(sourcePath.toString());

        FFmpegOutputBuilder outputBuilder = builder.addOutput(outputDir.resolve(PLAYLIST_FILE_NAME).toString());
        configureVideo(outputBuilder, profile);
        configureAudio(outputBuilder, profile);
        configureHls(outputBuilder, outputDir, segmentDuration);
        outputBuilder.done();

        if (log.isDebugEnabled()) {
            log.debug("{} FFmpeg command (bramp): {}", logPrefix, String.join(" ", builder.build()));
        }
        return builder;
    }

    private void configureVideo(FFmpegOutputBuilder outputBuilder, TranscodeProfile profile) {
        long bitrate = profile.videoBitrateBps();
        outputBuilder.setVideoCodec("libx264")
                .setPreset("veryfast")
                .setConstantRateFactor(23)
                .setVideoBitRate(bitrate)
                .setVideoFilter("scale=-2:" + profile.height())
                .addExtraArgs("-maxrate", String.valueOf(bitrate), "-bufsize", String.valueOf(bitrate * 2));
    }

    private void configureAudio(FFmpegOutputBuilder outputBuilder, TranscodeProfile profile) {
        outputBuilder.setAudioCodec("aac")
                .setAudioChannels(FFmpeg.AUDIO_STEREO)
                .setAudioBitRate(profile.audioBitrateBps());
    }

    private void configureHls(FFmpegOutputBuilder outputBuilder, Path outputDir, Duration segmentDuration) {
        outputBuilder.setFormat("hls")
                .addExtraArgs("-hls_time", String.valueOf(segmentDuration.toSeconds()))
                .addExtraArgs("-hls_playlist_type", "vod")
                .addExtraArgs("-hls_flags", "independent_segments")
                .addExtraArgs("-hls_segment_filename", outputDir.resolve(SEGMENT_FILE_PATTERN).toString());
    }

    @Override
    public void executeFfmpegJob(FFmpegBuilder builder, Long videoId, String logContext)
            throws FfmpegProcessingException, TimeoutException, InterruptedException {
        String logPrefix = logPrefix(logContext);

        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.addAll(builder.build());
        log.info("{} Starting FFmpeg for video ID: {} (timeout {})", logPrefix, videoId, jobTimeout);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new FfmpegProcessingException("Failed to start FFmpeg for video ID " + videoId + ": " + e.getMessage(), e);
        }

        Future<String> stdout = streamExecutor.submit(() -> drain(process.getInputStream()));
        Future<String> stderr = streamExecutor.submit(() -> drain(process.getErrorStream()));

        boolean finished;
        try {
            finished = process.waitFor(jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        }
        if (!finished) {
            process.destroyForcibly();
            log.warn("{} FFmpeg exceeded {} for video ID: {}, process killed", logPrefix, jobTimeout, videoId);
            throw new TimeoutException("FFmpeg exceeded the job timeout of " + jobTimeout + " for video ID " + videoId);
        }

        int exitCode = process.exitValue();
        collect(stdout, "STDOUT", logPrefix);
        String errorOutput = collect(stderr, "STDERR", logPrefix);

        if (exitCode != 0) {
            String tail = tail(errorOutput);
            log.error("{} FFmpeg exited with code {} for video ID: {}. stderr: {}", logPrefix, exitCode, videoId, tail);
            throw new FfmpegProcessingException(
                    "FFmpeg process failed for video ID " + videoId + " with exit code " + exitCode, exitCode, tail);
        }
        log.info("{} FFmpeg completed successfully for video ID: {}", logPrefix, videoId);
    }

    @Override
    public OptionalInt probeVideoHeight(Path sourcePath) throws FfmpegProcessingException {
        FFprobe ffprobe = ffprobeProvider.getIfAvailable();
        if (ffprobe == null) {
            return OptionalInt.empty();
        }
        FFmpegProbeResult result;
        try {
            result = ffprobe.probe(sourcePath.toString());
        } catch (IOException e) {
            throw new FfmpegProcessingException("Failed to probe source " + sourcePath.getFileName() + ": " + e.getMessage(), e);
        }
        if (result.getStreams() != null) {
            for (FFmpegStream stream : result.getStreams()) {
                if (stream.codec_type == FFmpegStream.CodecType.VIDEO && stream.height > 0) {
                    return OptionalInt.of(stream.height);
                }
            }
        }
        throw new FfmpegProcessingException("Source " + sourcePath.getFileName() + " has no video stream", null);
    }

    private static String drain(InputStream stream) throws IOException {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String collect(Future<String> future, String streamName, String logPrefix) {
        try {
            return future.get(STREAM_DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StreamOutputRetrievalException("Interrupted while reading FFmpeg " + streamName, streamName, e);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("{} Could not capture FFmpeg {}: {}", logPrefix, streamName, e.getMessage());
            throw new StreamOutputRetrievalException("Failed to capture FFmpeg " + streamName, streamName, e);
        }
    }

    private static String tail(String output) {
        if (output == null) {
            return "";
        }
        String trimmed = output.strip();
        return trimmed.length() <= STDERR_TAIL_CHARS ? trimmed : trimmed.substring(trimmed.length() - STDERR_TAIL_CHARS);
    }

    private static String logPrefix(String logContext) {
        return String.format("[FfmpegService]%s", logContext != null ? "[" + logContext + "]" : "");
    }
}
