package com.example.vidstream.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record EnqueueTranscodeRequest(
        @NotNull(message = "Video id must be provided")
        @Positive(message = "Video id must be positive")
        Long videoId,
        String profile,    // Optional: omitted means every configured profile
        Boolean overwrite  // Optional: defaults to false
) {

    public boolean overwriteRequested() {
        return Boolean.TRUE.equals(overwrite);
    }

    public boolean allProfiles() {
        return profile == null || profile.isBlank();
    }
}
