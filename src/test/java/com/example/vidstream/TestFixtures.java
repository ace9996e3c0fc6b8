package com.example.vidstream;

import com.example.vidstream.config.TranscodeProperties;
import com.example.vidstream.config.TranscodeProperties.ProfileDefinition;
import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.domain.TranscodeJob.JobStatus;
import com.example.vidstream.domain.TranscodeProfiles;
import com.example.vidstream.domain.Video;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class TestFixtures {

    public static final List<ProfileDefinition> LADDER = List.of(
            new ProfileDefinition("480p", 480, 1400, 128),
            new ProfileDefinition("720p", 720, 2800, 128),
            new ProfileDefinition("1080p", 1080, 5000, 192)
    );

    private TestFixtures() {
    }

    public static TranscodeProperties properties(Path hlsRoot) {
        return new TranscodeProperties(hlsRoot.toString(), 2, Duration.ofSeconds(4), 3,
                Duration.ofSeconds(10), Duration.ofSeconds(30),
                Duration.ofMillis(100), Duration.ofSeconds(1),
                Duration.ofMillis(100), Duration.ofHours(1), LADDER);
    }

    public static TranscodeProfiles profiles() {
        return TranscodeProfiles.fromDefinitions(LADDER);
    }

    public static Video video(Long id, String sourcePath) {
        Video video = new Video("Video " + id, sourcePath);
        ReflectionTestUtils.setField(video, "id", id);
        return video;
    }

    public static TranscodeJob job(Long id, Long videoId, String profile, JobStatus status, int attempts) {
        TranscodeJob job = new TranscodeJob(videoId, profile, false, Instant.now().minusSeconds(60));
        job.setId(id);
        job.setStatus(status);
        job.setAttempts(attempts);
        return job;
    }

    /**
     * Writes a finished VOD playlist with {@code segments} non-empty segments into {@code dir}.
     */
    public static void writeRendition(Path dir, int segments, String marker) throws IOException {
        Files.createDirectories(dir);
        StringBuilder playlist = new StringBuilder("#EXTM3U\n#EXT-X-VERSION:3\n#EXT-X-TARGETDURATION:4\n#EXT-X-PLAYLIST-TYPE:VOD\n");
        for (int i = 0; i < segments; i++) {
            String name = String.format("%03d.ts", i);
            Files.writeString(dir.resolve(name), marker + "-segment-" + i, StandardCharsets.UTF_8);
            playlist.append("#EXTINF:4.000000,\n").append(name).append('\n');
        }
        playlist.append("#EXT-X-ENDLIST\n");
        Files.writeString(dir.resolve("index.m3u8"), playlist.toString(), StandardCharsets.UTF_8);
    }
}
