package com.example.vidstream.service;

import java.nio.file.Path;
import java.util.List;

/**
 * A complete rendition on disk: the playlist and its segments in playback order.
 */
public record RenditionArtifact(Path playlist, List<Path> segments) {

    public RenditionArtifact {
        segments = List.copyOf(segments);
    }
}
