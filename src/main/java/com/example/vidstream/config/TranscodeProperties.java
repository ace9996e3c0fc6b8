package com.example.vidstream.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Startup configuration of the transcode queue and the rendition ladder.
 * Bound once from {@code transcode.*} and handed to the components that need it.
 *
 * @param hlsRoot          root directory of the rendition output trees
 * @param workers          number of parallel transcode workers; zero or less means one per available core
 * @param segmentDuration  target HLS segment duration
 * @param maxAttempts      attempts a job gets before it is marked FAILED
 * @param jobTimeout       wall-clock ceiling of a single encode
 * @param leaseTimeout     age after which a RUNNING job is considered orphaned
 * @param backoffBase      delay before the first retry, doubled on every further attempt
 * @param backoffMax       upper bound of the retry delay
 * @param dispatchInterval fixed delay of the dispatcher tick
 * @param recoveryInterval fixed delay of the lease recovery sweep
 * @param profiles         ordered rendition ladder, lowest quality first
 */
@Validated
@ConfigurationProperties(prefix = "transcode")
public record TranscodeProperties(
        @NotBlank String hlsRoot,
        int workers,
        @NotNull Duration segmentDuration,
        @Min(1) int maxAttempts,
        @NotNull Duration jobTimeout,
        @NotNull Duration leaseTimeout,
        @NotNull Duration backoffBase,
        @NotNull Duration backoffMax,
        @NotNull Duration dispatchInterval,
        @NotNull Duration recoveryInterval,
        @NotEmpty @Valid List<ProfileDefinition> profiles
) {

    public TranscodeProperties {
        if (segmentDuration != null && segmentDuration.toSeconds() < 1) {
            throw new IllegalArgumentException("transcode.segment-duration must be at least one second");
        }
        if (jobTimeout != null && leaseTimeout != null && leaseTimeout.compareTo(jobTimeout) <= 0) {
            throw new IllegalArgumentException(
                    "transcode.lease-timeout (" + leaseTimeout + ") must be longer than transcode.job-timeout (" + jobTimeout + ")");
        }
        profiles = profiles == null ? List.of() : List.copyOf(profiles);
    }

    /**
     * Worker pool size with the "one per core" default applied.
     */
    public int effectiveWorkers() {
        return workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * One rung of the ladder as written in configuration.
     */
    public record ProfileDefinition(
            @NotBlank @Pattern(regexp = "^[0-9]{3,4}p$", message = "Profile name must look like 480p") String name,
            @Positive int height,
            @Positive int videoBitrateKbps,
            @Positive int audioBitrateKbps
    ) {}
}
