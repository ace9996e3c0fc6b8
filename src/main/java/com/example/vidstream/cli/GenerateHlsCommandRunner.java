package com.example.vidstream.cli;

import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.domain.TranscodeJob.JobStatus;
import com.example.vidstream.domain.Video;
import com.example.vidstream.exceptions.InvalidProfileException;
import com.example.vidstream.exceptions.JobConflictException;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.repository.VideoRepository;
import com.example.vidstream.service.EnqueueResult;
import com.example.vidstream.service.JobQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Batch trigger on the application jar:
 * {@code --generate-hls [--video-id=N] [--profile=480p] [--overwrite] [--wait]}.
 * Enqueues through the same queue as the HTTP API, then exits. With {@code --wait} it exits only once
 * every job it touched is terminal, with status 1 if any of them failed.
 */
@Component
public class GenerateHlsCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(GenerateHlsCommandRunner.class);

    static final String GENERATE_HLS = "generate-hls";
    static final String VIDEO_ID = "video-id";
    static final String PROFILE = "profile";
    static final String OVERWRITE = "overwrite";
    static final String WAIT = "wait";

    static final int EXIT_OK = 0;
    static final int EXIT_JOBS_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final JobQueueService jobQueueService;
    private final VideoRepository videoRepository;
    private final ApplicationContext applicationContext;
    private final Duration pollInterval;

    public GenerateHlsCommandRunner(JobQueueService jobQueueService,
                                    VideoRepository videoRepository,
                                    ApplicationContext applicationContext,
                                    @Value("${cli.poll-interval:1s}") Duration pollInterval) {
        this.jobQueueService = jobQueueService;
        this.videoRepository = videoRepository;
        this.applicationContext = applicationContext;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(GENERATE_HLS)) {
            return;
        }
        int exitCode = execute(args);
        log.info("[CLI] generate-hls finished with exit code {}", exitCode);
        System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
    }

    int execute(ApplicationArguments args) {
        List<Long> videoIds;
        try {
            videoIds = targetVideos(args);
        } catch (NumberFormatException e) {
            log.error("[CLI] --{} must be a number: {}", VIDEO_ID, e.getMessage());
            return EXIT_USAGE;
        }
        String profile = singleValue(args, PROFILE);
        boolean overwrite = args.containsOption(OVERWRITE);

        Set<Long> jobIds = new LinkedHashSet<>();
        for (Long videoId : videoIds) {
            try {
                List<EnqueueResult> results = profile == null
                        ? jobQueueService.enqueueAll(videoId, overwrite)
                        : List.of(jobQueueService.enqueue(videoId, profile, overwrite));
                for (EnqueueResult result : results) {
                    report(videoId, result);
                    if (!result.isSkipped()) {
                        jobIds.add(result.job().getId());
                    }
                }
            } catch (JobConflictException e) {
                log.info("[CLI] Video {} skipped: {}", videoId, e.getMessage());
            } catch (ResourceNotFoundException | InvalidProfileException e) {
                log.error("[CLI] {}", e.getMessage());
                return EXIT_USAGE;
            }
        }
        log.info("[CLI] {} job(s) queued for {} video(s)", jobIds.size(), videoIds.size());

        if (!args.containsOption(WAIT) || jobIds.isEmpty()) {
            return EXIT_OK;
        }
        try {
            return awaitCompletion(jobIds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[CLI] Interrupted while waiting for jobs {}", jobIds);
            return EXIT_JOBS_FAILED;
        }
    }

    private List<Long> targetVideos(ApplicationArguments args) {
        String videoId = singleValue(args, VIDEO_ID);
        if (videoId != null) {
            return List.of(Long.valueOf(videoId.trim()));
        }
        return videoRepository.findAllByOrderByIdAsc().stream().map(Video::getId).toList();
    }

    private int awaitCompletion(Set<Long> jobIds) throws InterruptedException {
        while (true) {
            List<TranscodeJob> jobs = new ArrayList<>(jobIds.size());
            for (Long jobId : jobIds) {
                jobs.add(jobQueueService.status(jobId));
            }
            if (jobs.stream().allMatch(job -> job.getStatus().isTerminal())) {
                long failed = jobs.stream().filter(job -> job.getStatus() == JobStatus.FAILED).count();
                jobs.forEach(job -> log.info("[CLI] Job {} {} -> {}{}", job.getId(), job.key(), job.getStatus(),
                        job.getLastError() != null ? " (" + job.getLastError() + ")" : ""));
                return failed > 0 ? EXIT_JOBS_FAILED : EXIT_OK;
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    private static void report(Long videoId, EnqueueResult result) {
        if (result.isSkipped()) {
            log.info("[CLI] {}/{} skipped: {}", videoId, result.profileName(), result.skippedReason());
        } else {
            log.info("[CLI] {}/{} -> job {}{}", videoId, result.profileName(), result.job().getId(),
                    result.coalesced() ? " (already queued)" : "");
        }
    }

    private static String singleValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
