package com.example.vidstream.domain;

import jakarta.persistence.*;

/**
 * Source video reference. Rows are written by the catalog application; this service only reads them.
 */
@Entity
@Table(name = "videos")
public class Video {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 255)
    private String title;

    // Relative to video.storage.path; never rewritten once a job references it
    @Column(nullable = false, length = 512, updatable = false)
    private String sourcePath;

    public Video() {
    }

    public Video(String title, String sourcePath) {
        this.title = title;
        this.sourcePath = sourcePath;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getSourcePath() {
        return sourcePath;
    }
}
