package com.example.vidstream.service.impl;

import com.example.vidstream.domain.Rendition;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.exceptions.SegmentDeliveryException;
import com.example.vidstream.exceptions.VideoStorageException;
import com.example.vidstream.service.DeliveryPayload;
import com.example.vidstream.service.RenditionCatalog;
import com.example.vidstream.service.StreamingDeliveryService;
import com.example.vidstream.service.VideoStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

@Service
public class StreamingDeliveryServiceImpl implements StreamingDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(StreamingDeliveryServiceImpl.class);

    private final RenditionCatalog catalog;
    private final VideoStorageService storageService;

    public StreamingDeliveryServiceImpl(RenditionCatalog catalog, VideoStorageService storageService) {
        this.catalog = catalog;
        this.storageService = storageService;
    }

    @Override
    public DeliveryPayload getPlaylist(Long videoId, String resolution) {
        Rendition rendition = catalog.lookup(videoId, resolution);
        Resource resource = load(rendition.getPlaylistPath(), rendition);
        return new DeliveryPayload(resource, DeliveryPayload.PLAYLIST_MEDIA_TYPE);
    }

    @Override
    public DeliveryPayload getSegment(Long videoId, String resolution, int index) {
        Rendition rendition = catalog.lookup(videoId, resolution);
        if (index < 0 || index >= rendition.getSegmentCount()) {
            throw new ResourceNotFoundException("Segment " + index + " of rendition " + resolution + " of video "
                    + videoId + " does not exist (" + rendition.getSegmentCount() + " segments)");
        }
        Resource resource = load(rendition.getSegmentPaths().get(index), rendition);
        return new DeliveryPayload(resource, DeliveryPayload.SEGMENT_MEDIA_TYPE);
    }

    private Resource load(String relativePath, Rendition rendition) {
        try {
            return storageService.loadRenditionFile(relativePath);
        } catch (VideoStorageException e) {
            log.error("[Delivery] Registered file {} of rendition {}/{} cannot be served: {}",
                    relativePath, rendition.getVideoId(), rendition.getProfileName(), e.getMessage());
            throw new SegmentDeliveryException("Rendition file is registered but cannot be read", e);
        }
    }
}
