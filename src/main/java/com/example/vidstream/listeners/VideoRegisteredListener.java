package com.example.vidstream.listeners;

import com.example.vidstream.events.VideoRegisteredEvent;
import com.example.vidstream.service.EnqueueResult;
import com.example.vidstream.service.JobQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

@Component
public class VideoRegisteredListener {

    private static final Logger log = LoggerFactory.getLogger(VideoRegisteredListener.class);

    private final JobQueueService jobQueueService;
    private final boolean autoEnqueue;

    public VideoRegisteredListener(JobQueueService jobQueueService,
                                   @Value("${transcode.auto-enqueue:true}") boolean autoEnqueue) {
        this.jobQueueService = jobQueueService;
        this.autoEnqueue = autoEnqueue;
    }

    /**
     * Enqueues every configured profile of a newly registered video once its row is committed.
     * Runs on the async pool so registration never waits for the queue.
     */
    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleVideoRegistered(VideoRegisteredEvent event) {
        if (!autoEnqueue) {
            log.debug("Auto-enqueue disabled, video {} waits for an explicit transcode request", event.getVideoId());
            return;
        }
        try {
            List<EnqueueResult> results = jobQueueService.enqueueAll(event.getVideoId(), false);
            log.info("Auto-enqueued {} profile(s) for new video {}", results.size(), event.getVideoId());
        } catch (RuntimeException e) {
            log.error("Failed to auto-enqueue transcodes for video {}: {}", event.getVideoId(), e.getMessage(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_ROLLBACK)
    public void handleVideoRegisteredRollback(VideoRegisteredEvent event) {
        log.warn("Transaction rolled back for VideoRegisteredEvent of video {}. Nothing enqueued.", event.getVideoId());
    }
}
