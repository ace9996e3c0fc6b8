package com.example.vidstream.service;

public interface VideoAccessPolicy {

    /**
     * Checks if the caller may stream or transcode the video.
     *
     * @param caller  The verified subject of the caller's token.
     * @param videoId The ID of the video.
     * @return true if access is allowed, false otherwise.
     */
    boolean isAuthorized(String caller, Long videoId);
}
