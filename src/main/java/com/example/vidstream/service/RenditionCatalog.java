package com.example.vidstream.service;

import com.example.vidstream.domain.Rendition;
import com.example.vidstream.domain.TranscodeProfile;
import com.example.vidstream.exceptions.InvalidProfileException;
import com.example.vidstream.exceptions.JobConflictException;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.exceptions.VideoStorageException;

import java.util.List;

/**
 * Authoritative record of which renditions exist and are ready to stream.
 */
public interface RenditionCatalog {

    /**
     * Called when a job starts. Creates or resets the rendition of a key to not ready, without segments,
     * unless it is ready: a ready rendition keeps streaming until {@link #register} replaces it.
     */
    void markPending(Long videoId, TranscodeProfile profile, Long jobId);

    /**
     * Verifies the artifact on disk and records it as ready, atomically.
     *
     * @throws VideoStorageException if the playlist or a segment is missing or empty; a previously ready
     *                               rendition of the key is withdrawn in that case
     */
    Rendition register(Long videoId, TranscodeProfile profile, RenditionArtifact artifact, Long jobId)
            throws VideoStorageException;

    /**
     * @throws InvalidProfileException   if the profile is not configured
     * @throws ResourceNotFoundException if there is no ready rendition
     */
    Rendition lookup(Long videoId, String profileName);

    boolean isReady(Long videoId, String profileName);

    /**
     * Ready profiles of a video, lowest quality first.
     */
    List<TranscodeProfile> list(Long videoId);

    /**
     * Deletes every rendition of the video, rows and files.
     *
     * @throws JobConflictException while a job for the video is queued or running
     */
    void purge(Long videoId);
}
