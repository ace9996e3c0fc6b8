package com.example.vidstream.repository;

import com.example.vidstream.domain.Rendition;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface RenditionRepository extends CrudRepository<Rendition, Long> {

    Optional<Rendition> findByVideoIdAndProfileName(Long videoId, String profileName);

    Optional<Rendition> findByVideoIdAndProfileNameAndReadyTrue(Long videoId, String profileName);

    List<Rendition> findByVideoIdAndReadyTrue(Long videoId);

    List<Rendition> findByVideoId(Long videoId);
}
