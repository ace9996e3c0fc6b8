package com.example.vidstream.web.controller;

import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.service.DeliveryPayload;
import com.example.vidstream.service.StreamingDeliveryService;
import com.example.vidstream.service.VideoAccessPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HLS playback endpoints. Responses carry the file as a {@link Resource}, so byte range requests
 * are answered with 206 Partial Content by Spring MVC.
 */
@RestController
@RequestMapping("/api/video")
public class StreamingController {

    private static final Logger log = LoggerFactory.getLogger(StreamingController.class);

    // "3" or "003.ts"
    private static final Pattern SEGMENT_REFERENCE = Pattern.compile("^(\\d{1,6})(\\.ts)?$");

    private final StreamingDeliveryService deliveryService;
    private final VideoAccessPolicy accessPolicy;

    public StreamingController(StreamingDeliveryService deliveryService, VideoAccessPolicy accessPolicy) {
        this.deliveryService = deliveryService;
        this.accessPolicy = accessPolicy;
    }

    @GetMapping("/{videoId}/{resolution}/index.m3u8")
    public ResponseEntity<Resource> getPlaylist(@PathVariable Long videoId,
                                                @PathVariable String resolution,
                                                Authentication authentication) {
        authorize(authentication, videoId);
        DeliveryPayload payload = deliveryService.getPlaylist(videoId, resolution);
        log.debug("Serving playlist {}/{}", videoId, resolution);
        return ResponseEntity.ok().contentType(payload.contentType()).body(payload.resource());
    }

    @GetMapping("/{videoId}/{resolution}/{segment}")
    public ResponseEntity<Resource> getSegment(@PathVariable Long videoId,
                                               @PathVariable String resolution,
                                               @PathVariable String segment,
                                               Authentication authentication) {
        authorize(authentication, videoId);
        int index = parseSegmentIndex(segment);
        DeliveryPayload payload = deliveryService.getSegment(videoId, resolution, index);
        log.debug("Serving segment {} of {}/{}", index, videoId, resolution);
        return ResponseEntity.ok().contentType(payload.contentType()).body(payload.resource());
    }

    static int parseSegmentIndex(String segment) {
        Matcher matcher = SEGMENT_REFERENCE.matcher(segment);
        if (!matcher.matches()) {
            throw new ResourceNotFoundException("Segment not found: " + segment);
        }
        return Integer.parseInt(matcher.group(1));
    }

    private void authorize(Authentication authentication, Long videoId) {
        String caller = authentication != null ? authentication.getName() : null;
        if (!accessPolicy.isAuthorized(caller, videoId)) {
            log.warn("Streaming access to video {} denied for {}", videoId, caller);
            throw new AccessDeniedException("Access to video " + videoId + " is not allowed");
        }
    }
}
