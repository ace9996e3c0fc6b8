package com.example.vidstream.service;

import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;

/**
 * A rendition file ready to be written to the client.
 */
public record DeliveryPayload(Resource resource, MediaType contentType) {

    public static final MediaType PLAYLIST_MEDIA_TYPE = MediaType.parseMediaType("application/vnd.apple.mpegurl");
    public static final MediaType SEGMENT_MEDIA_TYPE = MediaType.parseMediaType("video/MP2T");
}
