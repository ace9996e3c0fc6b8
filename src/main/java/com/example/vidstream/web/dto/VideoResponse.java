package com.example.vidstream.web.dto;

import com.example.vidstream.domain.Video;

public record VideoResponse(Long id, String title, String sourcePath) {

    public static VideoResponse fromEntity(Video video) {
        return new VideoResponse(video.getId(), video.getTitle(), video.getSourcePath());
    }
}
