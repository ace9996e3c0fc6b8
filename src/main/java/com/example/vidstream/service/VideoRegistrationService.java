package com.example.vidstream.service;

import com.example.vidstream.domain.Video;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import org.springframework.web.server.ResponseStatusException;

public interface VideoRegistrationService {

    /**
     * Records a source video that already sits under the source root. Once committed, every configured
     * profile is enqueued for it (see {@code transcode.auto-enqueue}).
     *
     * @throws ResourceNotFoundException if the source file does not exist
     * @throws ResponseStatusException   400 if the path is blank or escapes the source root
     */
    Video register(String title, String sourcePath);
}
