package com.example.vidstream.web.controller;

import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.service.EnqueueResult;
import com.example.vidstream.service.JobQueueService;
import com.example.vidstream.service.RenditionCatalog;
import com.example.vidstream.service.VideoAccessPolicy;
import com.example.vidstream.web.dto.EnqueueTranscodeRequest;
import com.example.vidstream.web.dto.EnqueueTranscodeResponse;
import com.example.vidstream.web.dto.JobStatusResponse;
import com.example.vidstream.web.dto.RenditionListResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class TranscodeJobController {

    private static final Logger log = LoggerFactory.getLogger(TranscodeJobController.class);

    private final JobQueueService jobQueueService;
    private final RenditionCatalog renditionCatalog;
    private final VideoAccessPolicy accessPolicy;

    public TranscodeJobController(JobQueueService jobQueueService,
                                  RenditionCatalog renditionCatalog,
                                  VideoAccessPolicy accessPolicy) {
        this.jobQueueService = jobQueueService;
        this.renditionCatalog = renditionCatalog;
        this.accessPolicy = accessPolicy;
    }

    @PostMapping(value = "/transcodes", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EnqueueTranscodeResponse> enqueue(
            @RequestBody @Valid EnqueueTranscodeRequest request,
            Authentication authentication) {

        authorize(authentication, request.videoId());
        log.info("Transcode request from {} for video {} (profile: {}, overwrite: {})",
                authentication.getName(), request.videoId(),
                request.allProfiles() ? "all" : request.profile(), request.overwriteRequested());

        List<EnqueueResult> results = request.allProfiles()
                ? jobQueueService.enqueueAll(request.videoId(), request.overwriteRequested())
                : List.of(jobQueueService.enqueue(request.videoId(), request.profile(), request.overwriteRequested()));

        return ResponseEntity.accepted().body(EnqueueTranscodeResponse.fromResults(request.videoId(), results));
    }

    @GetMapping("/transcodes/{jobId}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable Long jobId, Authentication authentication) {
        TranscodeJob job = jobQueueService.status(jobId);
        authorize(authentication, job.getVideoId());
        return ResponseEntity.ok(JobStatusResponse.fromEntity(job));
    }

    @DeleteMapping("/transcodes/{jobId}")
    public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable Long jobId, Authentication authentication) {
        TranscodeJob job = jobQueueService.status(jobId);
        authorize(authentication, job.getVideoId());
        TranscodeJob cancelled = jobQueueService.cancel(jobId);
        log.info("Job {} cancelled by {}", jobId, authentication.getName());
        return ResponseEntity.ok(JobStatusResponse.fromEntity(cancelled));
    }

    @GetMapping("/videos/{videoId}/transcodes")
    public ResponseEntity<List<JobStatusResponse>> listJobs(@PathVariable Long videoId, Authentication authentication) {
        authorize(authentication, videoId);
        List<JobStatusResponse> jobs = jobQueueService.jobsForVideo(videoId).stream()
                .map(JobStatusResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(jobs);
    }

    @GetMapping("/videos/{videoId}/renditions")
    public ResponseEntity<RenditionListResponse> listRenditions(@PathVariable Long videoId, Authentication authentication) {
        authorize(authentication, videoId);
        return ResponseEntity.ok(RenditionListResponse.of(videoId, renditionCatalog.list(videoId)));
    }

    @DeleteMapping("/videos/{videoId}/renditions")
    public ResponseEntity<Void> purgeRenditions(@PathVariable Long videoId, Authentication authentication) {
        authorize(authentication, videoId);
        renditionCatalog.purge(videoId);
        log.info("Renditions of video {} purged by {}", videoId, authentication.getName());
        return ResponseEntity.noContent().build();
    }

    private void authorize(Authentication authentication, Long videoId) {
        String caller = authentication != null ? authentication.getName() : null;
        if (!accessPolicy.isAuthorized(caller, videoId)) {
            log.warn("Access to video {} denied for {}", videoId, caller);
            throw new AccessDeniedException("Access to video " + videoId + " is not allowed");
        }
    }
}
