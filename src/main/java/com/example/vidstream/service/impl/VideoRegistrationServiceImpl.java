package com.example.vidstream.service.impl;

import com.example.vidstream.domain.Video;
import com.example.vidstream.events.VideoRegisteredEvent;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.exceptions.VideoStorageException;
import com.example.vidstream.repository.VideoRepository;
import com.example.vidstream.service.VideoRegistrationService;
import com.example.vidstream.service.VideoStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class VideoRegistrationServiceImpl implements VideoRegistrationService {

    private static final Logger log = LoggerFactory.getLogger(VideoRegistrationServiceImpl.class);

    private final VideoRepository videoRepository;
    private final VideoStorageService storageService;
    private final ApplicationEventPublisher eventPublisher;

    public VideoRegistrationServiceImpl(VideoRepository videoRepository,
                                        VideoStorageService storageService,
                                        ApplicationEventPublisher eventPublisher) {
        this.videoRepository = videoRepository;
        this.storageService = storageService;
        this.eventPublisher = eventPublisher;
    }

    @Override
    @Transactional
    public Video register(String title, String sourcePath) {
        Path source;
        try {
            source = storageService.resolveSource(sourcePath);
        } catch (VideoStorageException e) {
            log.warn("Rejected video registration with source path '{}': {}", sourcePath, e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid source path: " + sourcePath, e);
        }
        if (!Files.isRegularFile(source)) {
            throw new ResourceNotFoundException("Source file not found: " + sourcePath);
        }
        Video video = videoRepository.save(new Video(title, sourcePath));
        log.info("Registered video {} ('{}') with source {}", video.getId(), title, sourcePath);
        eventPublisher.publishEvent(new VideoRegisteredEvent(this, video.getId(), sourcePath));
        return video;
    }
}
