package com.example.vidstream.service;

import com.example.vidstream.exceptions.InvalidProfileException;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.exceptions.SegmentDeliveryException;

/**
 * Read side of the catalog: resolves playlists and segments of ready renditions to files.
 *
 * <p>Both operations throw {@link InvalidProfileException} for an unknown resolution,
 * {@link ResourceNotFoundException} when the rendition or segment does not exist, and
 * {@link SegmentDeliveryException} when a registered file cannot be read.
 */
public interface StreamingDeliveryService {

    DeliveryPayload getPlaylist(Long videoId, String resolution);

    DeliveryPayload getSegment(Long videoId, String resolution, int index);
}
