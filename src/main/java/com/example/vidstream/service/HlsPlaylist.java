package com.example.vidstream.service;

import com.example.vidstream.exceptions.VideoStorageException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal reader for the media playlists the encoder writes.
 * Only segment URIs and the end-of-list marker are of interest.
 */
public final class HlsPlaylist {

    public static final String END_LIST_TAG = "#EXT-X-ENDLIST";
    private static final String HEADER_TAG = "#EXTM3U";

    private final List<String> segmentUris;
    private final boolean endList;

    private HlsPlaylist(List<String> segmentUris, boolean endList) {
        this.segmentUris = List.copyOf(segmentUris);
        this.endList = endList;
    }

    public static HlsPlaylist read(Path playlistFile) throws VideoStorageException {
        try {
            return parse(Files.readString(playlistFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new VideoStorageException("Failed to read playlist " + playlistFile, e);
        }
    }

    public static HlsPlaylist parse(String content) {
        List<String> uris = new ArrayList<>();
        boolean endList = false;
        boolean header = false;
        for (String raw : content.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("#")) {
                header |= line.equals(HEADER_TAG);
                endList |= line.equals(END_LIST_TAG);
                continue;
            }
            uris.add(line);
        }
        if (!header) {
            // not an HLS playlist at all, treat as empty
            return new HlsPlaylist(List.of(), false);
        }
        return new HlsPlaylist(uris, endList);
    }

    public List<String> segmentUris() {
        return segmentUris;
    }

    /**
     * A VOD playlist is only final once the encoder has written the end marker.
     */
    public boolean isComplete() {
        return endList && !segmentUris.isEmpty();
    }
}
