package com.example.vidstream.web.dto;

import com.example.vidstream.domain.TranscodeProfile;

import java.util.List;

public record RenditionListResponse(Long videoId, List<String> profiles) {

    public static RenditionListResponse of(Long videoId, List<TranscodeProfile> ready) {
        return new RenditionListResponse(videoId, ready.stream().map(TranscodeProfile::name).toList());
    }
}
