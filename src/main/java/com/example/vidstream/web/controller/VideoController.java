package com.example.vidstream.web.controller;

import com.example.vidstream.domain.Video;
import com.example.vidstream.service.VideoRegistrationService;
import com.example.vidstream.web.dto.RegisterVideoRequest;
import com.example.vidstream.web.dto.VideoResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/videos")
public class VideoController {

    private static final Logger log = LoggerFactory.getLogger(VideoController.class);

    private final VideoRegistrationService registrationService;

    public VideoController(VideoRegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<VideoResponse> registerVideo(@RequestBody @Valid RegisterVideoRequest request,
                                                       Authentication authentication) {
        log.info("Video registration from {} for source {}", authentication.getName(), request.sourcePath());
        Video video = registrationService.register(request.title(), request.sourcePath());
        return ResponseEntity.status(HttpStatus.CREATED).body(VideoResponse.fromEntity(video));
    }
}
