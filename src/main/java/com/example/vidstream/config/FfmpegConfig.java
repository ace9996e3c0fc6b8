package com.example.vidstream.config;

import net.bramp.ffmpeg.FFprobe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class FfmpegConfig {

    private static final Logger log = LoggerFactory.getLogger(FfmpegConfig.class);

    @Value("${ffprobe.path:}")
    private String ffprobePath;

    /**
     * Probe used to read the source resolution before encoding. Without it the
     * "never upscale" check is skipped and every profile is encoded.
     */
    @Bean
    public FFprobe fFprobe() {
        if (ffprobePath == null || ffprobePath.isBlank()) {
            log.warn("ffprobe.path is not configured. Source resolution checks are disabled.");
            return null;
        }
        try {
            log.info("Creating FFprobe bean with path: {}", ffprobePath);
            return new FFprobe(ffprobePath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize FFprobe with path: " + ffprobePath, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid configuration for FFprobe path: " + ffprobePath, e);
        }
    }
}
