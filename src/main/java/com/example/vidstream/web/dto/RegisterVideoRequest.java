package com.example.vidstream.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterVideoRequest(
        @Size(max = 255, message = "Title cannot exceed 255 characters")
        String title,
        @NotBlank(message = "Source path must be provided")
        @Size(max = 512, message = "Source path cannot exceed 512 characters")
        String sourcePath  // Relative to video.storage.path
) {
}
