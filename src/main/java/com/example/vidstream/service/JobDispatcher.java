package com.example.vidstream.service;

import com.example.vidstream.config.AsyncConfig;
import com.example.vidstream.config.TranscodeProperties;
import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.events.JobEnqueuedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands queued jobs to the worker pool, oldest first, never more than the pool can run.
 * Also owns the sweep that requeues jobs whose lease expired.
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStatusUpdater statusUpdater;
    private final TranscodeWorker worker;
    private final TaskExecutor workerExecutor;
    private final TranscodeProperties properties;
    private final int capacity;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public JobDispatcher(JobStatusUpdater statusUpdater,
                         TranscodeWorker worker,
                         @Qualifier(AsyncConfig.TRANSCODE_WORKER_EXECUTOR) TaskExecutor workerExecutor,
                         TranscodeProperties properties) {
        this.statusUpdater = statusUpdater;
        this.worker = worker;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
        this.capacity = properties.effectiveWorkers();
    }

    /**
     * Claims jobs until the pool is full or nothing is eligible.
     */
    public synchronized void pump() {
        while (inFlight.size() < capacity) {
            Optional<TranscodeJob> claimed;
            try {
                claimed = statusUpdater.claimNext(Instant.now());
            } catch (DataAccessException e) {
                log.warn("[Dispatcher] Claim failed, will retry on the next tick: {}", e.getMessage());
                return;
            }
            if (claimed.isEmpty()) {
                return;
            }
            submit(claimed.get());
        }
    }

    private void submit(TranscodeJob job) {
        Long jobId = job.getId();
        inFlight.add(jobId);
        try {
            workerExecutor.execute(() -> run(job));
            log.debug("[Dispatcher] Job {} handed to worker pool ({}/{} busy)", jobId, inFlight.size(), capacity);
        } catch (TaskRejectedException e) {
            inFlight.remove(jobId);
            log.warn("[Dispatcher] Worker pool rejected job {}: {}", jobId, e.getMessage());
            statusUpdater.release(jobId, "worker pool rejected the job");
        }
    }

    private void run(TranscodeJob job) {
        try {
            worker.process(job);
        } finally {
            inFlight.remove(job.getId());
            pump();
        }
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onJobEnqueued(JobEnqueuedEvent event) {
        log.debug("[Dispatcher] Job {} enqueued for {}/{}", event.getJobId(), event.getVideoId(), event.getProfileName());
        pump();
    }

    @Scheduled(fixedDelayString = "${transcode.dispatch-interval}", initialDelayString = "${transcode.dispatch-interval}")
    public void dispatchTick() {
        pump();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("[Dispatcher] Ready with {} worker slot(s), lease timeout {}", capacity, properties.leaseTimeout());
        recoverExpiredLeases();
        pump();
    }

    @Scheduled(fixedDelayString = "${transcode.recovery-interval}", initialDelayString = "${transcode.recovery-interval}")
    public void recoverExpiredLeases() {
        Instant cutoff = Instant.now().minus(properties.leaseTimeout());
        List<TranscodeJob> requeued;
        try {
            requeued = statusUpdater.requeueExpiredLeases(cutoff, Set.copyOf(inFlight));
        } catch (DataAccessException e) {
            log.warn("[Dispatcher] Lease sweep failed: {}", e.getMessage());
            return;
        }
        if (!requeued.isEmpty()) {
            log.warn("[Dispatcher] Requeued {} job(s) with expired leases", requeued.size());
            pump();
        }
    }

    public Set<Long> inFlightJobIds() {
        return Set.copyOf(inFlight);
    }
}
