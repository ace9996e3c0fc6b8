package com.example.vidstream.repository;

import com.example.vidstream.domain.Video;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface VideoRepository extends CrudRepository<Video, Long> {

    /**
     * All videos in id order, used by the CLI trigger when no video id is given.
     */
    List<Video> findAllByOrderByIdAsc();
}
