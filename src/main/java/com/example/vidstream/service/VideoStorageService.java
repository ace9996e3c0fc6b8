package com.example.vidstream.service;

import com.example.vidstream.exceptions.VideoStorageException;
import org.springframework.core.io.Resource;

import java.nio.file.Path;

/**
 * Filesystem access for source videos and rendition trees. Every path handed out is confined to
 * its configured root; rendition files are addressed by paths relative to the HLS root.
 */
public interface VideoStorageService {

    /**
     * Resolves a source path as stored on the video record.
     *
     * @throws VideoStorageException if the path is blank or escapes the source root
     */
    Path resolveSource(String sourcePath) throws VideoStorageException;

    /**
     * {@code <hls-root>/<videoId>/<profile>}. The directory is not created.
     */
    Path renditionDirectory(Long videoId, String profileName);

    /**
     * Creates an empty staging directory next to {@code outputDir}, on the same file system so it can be moved into place.
     */
    Path createStagingDirectory(Path outputDir) throws VideoStorageException;

    /**
     * Replaces {@code outputDir} with {@code stagingDir}. A previous output directory is renamed aside, swapped out
     * and then deleted, so no mix of old and new files is ever visible. If the swap fails the previous output is restored.
     */
    void publishStaging(Path stagingDir, Path outputDir) throws VideoStorageException;

    void deleteRecursively(Path path) throws VideoStorageException;

    /**
     * True when the file exists, is a regular file and is not empty.
     */
    boolean isComplete(Path file);

    /**
     * Loads a rendition file as a readable resource.
     *
     * @throws VideoStorageException if the file is missing, unreadable or outside the HLS root
     */
    Resource loadRenditionFile(String relativePath) throws VideoStorageException;

    /**
     * Removes the whole output tree of a video.
     */
    void deleteRenditions(Long videoId) throws VideoStorageException;

    /**
     * Path relative to the HLS root, always with forward slashes.
     */
    String relativize(Path renditionFile);
}
