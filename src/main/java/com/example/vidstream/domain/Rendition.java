package com.example.vidstream.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One independently playable encoding of a video at one profile.
 * Only rows with {@code ready = true} are ever handed to the streaming side.
 */
@Entity
@Table(name = "renditions",
        uniqueConstraints = @UniqueConstraint(name = "uk_rendition_video_profile", columnNames = {"video_id", "profile_name"}),
        indexes = @Index(name = "idx_rendition_video", columnList = "video_id"))
public class Rendition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "video_id", nullable = false, updatable = false)
    private Long videoId;

    @Column(name = "profile_name", nullable = false, updatable = false, length = 16)
    private String profileName;

    // Paths are relative to transcode.hls-root
    @Column(length = 512)
    private String playlistPath;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rendition_segments", joinColumns = @JoinColumn(name = "rendition_id"))
    @OrderColumn(name = "segment_index")
    @Column(name = "segment_path", nullable = false, length = 512)
    private List<String> segmentPaths = new ArrayList<>();

    @Column(nullable = false)
    private boolean ready;

    @Column
    private Long jobId;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public Rendition() {
    }

    public Rendition(Long videoId, String profileName) {
        this.videoId = videoId;
        this.profileName = profileName;
        this.updatedAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public Long getVideoId() {
        return videoId;
    }

    public String getProfileName() {
        return profileName;
    }

    public String getPlaylistPath() {
        return playlistPath;
    }

    public void setPlaylistPath(String playlistPath) {
        this.playlistPath = playlistPath;
    }

    public List<String> getSegmentPaths() {
        return segmentPaths;
    }

    public void replaceSegmentPaths(List<String> paths) {
        this.segmentPaths.clear();
        this.segmentPaths.addAll(paths);
    }

    public int getSegmentCount() {
        return segmentPaths.size();
    }

    public boolean isReady() {
        return ready;
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public Long getJobId() {
        return jobId;
    }

    public void setJobId(Long jobId) {
        this.jobId = jobId;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
