package com.example.vidstream.domain;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "transcode_jobs",
        indexes = {
                @Index(name = "idx_job_key", columnList = "videoId, profileName"),
                @Index(name = "idx_job_status", columnList = "status")
        })
public class TranscodeJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long videoId;

    @Column(nullable = false, updatable = false, length = 16)
    private String profileName;

    @Column(nullable = false)
    private boolean overwrite;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status = JobStatus.QUEUED;

    @Column(nullable = false)
    private int attempts;

    @Column(length = 2000)
    private String lastError;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    // Lease start of the current attempt
    @Column
    private Instant startedAt;

    @Column
    private Instant finishedAt;

    // Retry backoff gate; the dispatcher ignores the job before this instant
    @Column(nullable = false)
    private Instant notBefore;

    @Version
    private Long version;

    public enum JobStatus {
        QUEUED, // Waiting for a worker (first attempt or scheduled retry)
        RUNNING, // Claimed by a worker, lease started
        SUCCEEDED, // Rendition registered and ready
        FAILED, // Fatal error or attempts exhausted
        CANCELLED; // Cancelled while still queued

        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED || this == CANCELLED;
        }
    }

    public TranscodeJob() {
    }

    public TranscodeJob(Long videoId, String profileName, boolean overwrite, Instant createdAt) {
        this.videoId = videoId;
        this.profileName = profileName;
        this.overwrite = overwrite;
        this.createdAt = createdAt;
        this.notBefore = createdAt;
    }

    public String key() {
        return videoId + "/" + profileName;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getVideoId() {
        return videoId;
    }

    public String getProfileName() {
        return profileName;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public void setOverwrite(boolean overwrite) {
        this.overwrite = overwrite;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public Instant getNotBefore() {
        return notBefore;
    }

    public void setNotBefore(Instant notBefore) {
        this.notBefore = notBefore;
    }

    @Override
    public String toString() {
        return "TranscodeJob[id=" + id + ", key=" + key() + ", status=" + status + ", attempts=" + attempts + "]";
    }
}
