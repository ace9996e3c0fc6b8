package com.example.vidstream.service;

import com.example.vidstream.domain.TranscodeProfile;
import com.example.vidstream.exceptions.TranscodeException;

import java.nio.file.Path;

public interface TranscodeEngine {

    /**
     * Produces the HLS rendition of {@code sourcePath} for {@code profile} in {@code outputDir}.
     * With {@code overwrite=false} a complete existing rendition is returned as is. Output becomes
     * visible in {@code outputDir} only once it is complete.
     *
     * @param videoId used for logging only
     * @throws TranscodeException with {@link TranscodeException#isRetryable()} set for transient failures
     */
    RenditionArtifact transcode(Long videoId, Path sourcePath, TranscodeProfile profile, Path outputDir, boolean overwrite)
            throws TranscodeException;

    /**
     * The complete rendition currently in {@code outputDir}, or null when there is none.
     */
    RenditionArtifact findComplete(Path outputDir);
}
