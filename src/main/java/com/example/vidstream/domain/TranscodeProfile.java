package com.example.vidstream.domain;

/**
 * A named resolution/bitrate pair driving one transcode.
 * Instances only come from {@link TranscodeProfiles}; {@code rank} is the position in the configured ladder.
 */
public record TranscodeProfile(
        String name,
        int height,
        int videoBitrateKbps,
        int audioBitrateKbps,
        int rank
) {

    public long videoBitrateBps() {
        return videoBitrateKbps * 1000L;
    }

    public long audioBitrateBps() {
        return audioBitrateKbps * 1000L;
    }

    @Override
    public String toString() {
        return name;
    }
}
