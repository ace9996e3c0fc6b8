package com.example.vidstream.service.impl;

import com.example.vidstream.config.TranscodeProperties;
import com.example.vidstream.exceptions.VideoStorageException;
import com.example.vidstream.service.VideoStorageService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.UrlResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.MalformedURLException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

@Service
public class FilesystemVideoStorageServiceImpl implements VideoStorageService {
    private static final Logger log = LoggerFactory.getLogger(FilesystemVideoStorageServiceImpl.class);

    private static final String STAGING_MARKER = ".staging-";
    private static final String RETIRED_MARKER = ".retired-";

    private final Path sourceRoot;
    private final Path hlsRoot;

    public FilesystemVideoStorageServiceImpl(@Value("${video.storage.path}") String sourcePath,
                                             TranscodeProperties transcodeProperties) {
        this.sourceRoot = Paths.get(sourcePath).toAbsolutePath().normalize();
        this.hlsRoot = Paths.get(transcodeProperties.hlsRoot()).toAbsolutePath().normalize();
    }

    @PostConstruct
    private void initialize() {
        try {
            Files.createDirectories(sourceRoot);
            Files.createDirectories(hlsRoot);
            log.info("Video storage initialized. Sources: {}, renditions: {}", sourceRoot, hlsRoot);
        } catch (IOException e) {
            throw new VideoStorageException("Could not initialize storage directories under " + sourceRoot + " and " + hlsRoot, e);
        }
    }

    @Override
    public Path resolveSource(String sourcePath) throws VideoStorageException {
        return resolveWithin(sourceRoot, sourcePath);
    }

    @Override
    public Path renditionDirectory(Long videoId, String profileName) {
        if (videoId == null || profileName == null || profileName.isBlank()) {
            throw new VideoStorageException("Video id and profile name are required to locate a rendition directory");
        }
        return resolveWithin(hlsRoot, videoId + "/" + profileName);
    }

    @Override
    public Path createStagingDirectory(Path outputDir) throws VideoStorageException {
        Path parent = outputDir.getParent();
        try {
            Files.createDirectories(parent);
            Path staging = parent.resolve("." + outputDir.getFileName() + STAGING_MARKER + UUID.randomUUID());
            Files.createDirectory(staging);
            log.debug("Created staging directory {}", staging);
            return staging;
        } catch (IOException e) {
            throw new VideoStorageException("Failed to create staging directory for " + outputDir, e);
        }
    }

    @Override
    public void publishStaging(Path stagingDir, Path outputDir) throws VideoStorageException {
        Path retired = null;
        try {
            if (Files.exists(outputDir)) {
                retired = outputDir.resolveSibling("." + outputDir.getFileName() + RETIRED_MARKER + UUID.randomUUID());
                move(outputDir, retired);
            }
            try {
                move(stagingDir, outputDir);
            } catch (IOException e) {
                if (retired != null) {
                    move(retired, outputDir);
                    retired = null;
                }
                throw e;
            }
            log.info("Published rendition directory {}", outputDir);
        } catch (IOException e) {
            throw new VideoStorageException("Failed to publish " + stagingDir + " to " + outputDir, e);
        }
        deleteRecursively(retired);
    }

    private void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to a plain rename", to);
            Files.move(from, to);
        }
    }

    @Override
    public void deleteRecursively(Path path) throws VideoStorageException {
        if (path == null || !Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(p);
            }
            log.debug("Deleted {}", path);
        } catch (IOException e) {
            throw new VideoStorageException("Failed to delete " + path, e);
        }
    }

    @Override
    public boolean isComplete(Path file) {
        try {
            return file != null && Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            log.warn("Could not read size of {}: {}", file, e.getMessage());
            return false;
        }
    }

    @Override
    public Resource loadRenditionFile(String relativePath) throws VideoStorageException {
        try {
            Path file = resolveWithin(hlsRoot, relativePath);
            log.debug("Attempting to load rendition file: {}", file);

            Resource resource = new UrlResource(file.toUri());
            if (resource.exists() && resource.isReadable()) {
                return resource;
            }
            String reason = resource.exists() ? "not readable" : "does not exist";
            log.warn("Could not read rendition file {} ({})", file, reason);
            throw new VideoStorageException("Could not read file: " + relativePath + " (File " + reason + ")");
        } catch (MalformedURLException e) {
            throw new VideoStorageException("Could not read file (Malformed URL): " + relativePath, e);
        }
    }

    @Override
    public void deleteRenditions(Long videoId) throws VideoStorageException {
        Path videoDir = resolveWithin(hlsRoot, String.valueOf(videoId));
        deleteRecursively(videoDir);
        log.info("Deleted rendition tree of video {}", videoId);
    }

    @Override
    public String relativize(Path renditionFile) {
        Path normalized = renditionFile.toAbsolutePath().normalize();
        if (!normalized.startsWith(hlsRoot)) {
            throw new VideoStorageException("Path is outside the rendition root: " + renditionFile);
        }
        return hlsRoot.relativize(normalized).toString().replace('\\', '/');
    }

    private Path resolveWithin(Path root, String relativePath) throws VideoStorageException {
        if (relativePath == null || relativePath.isBlank()) {
            throw new VideoStorageException("Storage path cannot be null or blank.");
        }
        if (relativePath.contains("..") || relativePath.contains("\\")) {
            throw new VideoStorageException("Invalid characters found in storage path: " + relativePath);
        }
        try {
            Path resolvedPath = root.resolve(relativePath).normalize().toAbsolutePath();
            if (!resolvedPath.startsWith(root)) {
                throw new VideoStorageException("Security check failed: Cannot access file outside designated directory: " + relativePath);
            }
            return resolvedPath;
        } catch (InvalidPathException e) {
            throw new VideoStorageException("Invalid storage path provided: " + relativePath, e);
        }
    }
}
