package com.example.vidstream.service;

import com.example.vidstream.TestFixtures;
import com.example.vidstream.exceptions.VideoStorageException;
import com.example.vidstream.service.impl.FilesystemVideoStorageServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.Resource;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FilesystemVideoStorageService Implementation Tests")
class FilesystemVideoStorageServiceImplTest {

    @TempDir
    Path tempDir;

    private Path sourceRoot;
    private Path hlsRoot;
    private FilesystemVideoStorageServiceImpl storageService;

    @BeforeEach
    void setUp() {
        sourceRoot = tempDir.resolve("sources");
        hlsRoot = tempDir.resolve("hls");
        storageService = new FilesystemVideoStorageServiceImpl(sourceRoot.toString(), TestFixtures.properties(hlsRoot));
        ReflectionTestUtils.invokeMethod(storageService, "initialize");
    }

    @Test
    @DisplayName("✅ initialize: Should create both roots")
    void initialize_CreatesRoots() {
        assertThat(sourceRoot).isDirectory();
        assertThat(hlsRoot).isDirectory();
    }

    @Nested
    @DisplayName("Path resolution")
    class PathResolutionTests {

        @Test
        @DisplayName("✅ renditionDirectory: Should follow <root>/<videoId>/<profile>")
        void renditionDirectory_Layout() {
            assertThat(storageService.renditionDirectory(42L, "480p"))
                    .isEqualTo(hlsRoot.toAbsolutePath().normalize().resolve("42").resolve("480p"));
        }

        @Test
        @DisplayName("✅ resolveSource: Should resolve relative paths under the source root")
        void resolveSource_Relative() {
            assertThat(storageService.resolveSource("originals/a.mp4"))
                    .isEqualTo(sourceRoot.toAbsolutePath().normalize().resolve("originals/a.mp4"));
        }

        @Test
        @DisplayName("❌ resolveSource: Should reject traversal and absolute paths")
        void resolveSource_Traversal_Throws() {
            assertThatThrownBy(() -> storageService.resolveSource("../etc/passwd"))
                    .isInstanceOf(VideoStorageException.class)
                    .hasMessageContaining("Invalid characters");
            assertThatThrownBy(() -> storageService.resolveSource("/etc/passwd"))
                    .isInstanceOf(VideoStorageException.class)
                    .hasMessageContaining("Security check failed");
            assertThatThrownBy(() -> storageService.resolveSource(" "))
                    .isInstanceOf(VideoStorageException.class);
        }

        @Test
        @DisplayName("✅ relativize: Should produce forward-slash paths relative to the HLS root")
        void relativize_RelativeToRoot() {
            Path segment = storageService.renditionDirectory(7L, "720p").resolve("003.ts");
            assertThat(storageService.relativize(segment)).isEqualTo("7/720p/003.ts");
        }

        @Test
        @DisplayName("❌ relativize: Should reject files outside the HLS root")
        void relativize_Outside_Throws() {
            assertThatThrownBy(() -> storageService.relativize(sourceRoot.resolve("a.mp4")))
                    .isInstanceOf(VideoStorageException.class);
        }
    }

    @Nested
    @DisplayName("Staging and publishing")
    class StagingTests {

        @Test
        @DisplayName("✅ publishStaging: Should replace previous output completely")
        void publishStaging_ReplacesOutput() throws IOException {
            Path outputDir = storageService.renditionDirectory(1L, "480p");
            TestFixtures.writeRendition(outputDir, 5, "old");

            Path staging = storageService.createStagingDirectory(outputDir);
            assertThat(staging.getParent()).isEqualTo(outputDir.getParent());
            TestFixtures.writeRendition(staging, 2, "new");

            storageService.publishStaging(staging, outputDir);

            assertThat(staging).doesNotExist();
            assertThat(outputDir.resolve("000.ts")).hasContent("new-segment-0");
            assertThat(outputDir.resolve("001.ts")).exists();
            assertThat(outputDir.resolve("002.ts")).doesNotExist();
            assertThat(outputDir.resolve("004.ts")).doesNotExist();
            try (Stream<Path> siblings = Files.list(outputDir.getParent())) {
                assertThat(siblings).containsExactly(outputDir);
            }
        }

        @Test
        @DisplayName("✅ publishStaging: Should publish when there is no previous output")
        void publishStaging_NoPreviousOutput() throws IOException {
            Path outputDir = storageService.renditionDirectory(2L, "720p");
            Path staging = storageService.createStagingDirectory(outputDir);
            TestFixtures.writeRendition(staging, 1, "first");

            storageService.publishStaging(staging, outputDir);

            assertThat(outputDir.resolve("000.ts")).hasContent("first-segment-0");
            assertThat(staging).doesNotExist();
        }

        @Test
        @DisplayName("❌ publishStaging: Should keep the previous output when the staging directory is gone")
        void publishStaging_MissingStaging_KeepsPrevious() throws IOException {
            Path outputDir = storageService.renditionDirectory(3L, "480p");
            TestFixtures.writeRendition(outputDir, 2, "old");
            Path staging = outputDir.resolveSibling(".480p.staging-missing");

            assertThatThrownBy(() -> storageService.publishStaging(staging, outputDir))
                    .isInstanceOf(VideoStorageException.class);

            assertThat(outputDir.resolve("001.ts")).hasContent("old-segment-1");
            try (Stream<Path> siblings = Files.list(outputDir.getParent())) {
                assertThat(siblings).containsExactly(outputDir);
            }
        }

        @Test
        @DisplayName("✅ deleteRecursively: Should remove a tree and ignore missing paths")
        void deleteRecursively_RemovesTree() throws IOException {
            Path outputDir = storageService.renditionDirectory(1L, "480p");
            TestFixtures.writeRendition(outputDir, 2, "x");

            storageService.deleteRecursively(outputDir);
            storageService.deleteRecursively(outputDir);

            assertThat(outputDir).doesNotExist();
        }

        @Test
        @DisplayName("✅ deleteRenditions: Should remove every profile of a video only")
        void deleteRenditions_RemovesVideoTree() throws IOException {
            TestFixtures.writeRendition(storageService.renditionDirectory(1L, "480p"), 1, "a");
            TestFixtures.writeRendition(storageService.renditionDirectory(1L, "720p"), 1, "a");
            TestFixtures.writeRendition(storageService.renditionDirectory(2L, "480p"), 1, "b");

            storageService.deleteRenditions(1L);

            assertThat(hlsRoot.resolve("1")).doesNotExist();
            assertThat(hlsRoot.resolve("2/480p/index.m3u8")).exists();
        }
    }

    @Nested
    @DisplayName("Loading rendition files")
    class LoadTests {

        @Test
        @DisplayName("✅ loadRenditionFile: Should return a readable resource")
        void load_Success() throws IOException {
            TestFixtures.writeRendition(storageService.renditionDirectory(3L, "480p"), 1, "m");

            Resource resource = storageService.loadRenditionFile("3/480p/000.ts");

            assertThat(resource.exists()).isTrue();
            assertThat(resource.getContentAsByteArray()).isEqualTo("m-segment-0".getBytes());
        }

        @Test
        @DisplayName("❌ loadRenditionFile: Should throw for missing files")
        void load_Missing_Throws() {
            assertThatThrownBy(() -> storageService.loadRenditionFile("3/480p/999.ts"))
                    .isInstanceOf(VideoStorageException.class)
                    .hasMessageContaining("does not exist");
        }

        @Test
        @DisplayName("✅ isComplete: Empty files are not complete")
        void isComplete_EmptyFile() throws IOException {
            Path empty = Files.createFile(tempDir.resolve("empty.ts"));
            Path full = Files.writeString(tempDir.resolve("full.ts"), "data");

            assertThat(storageService.isComplete(empty)).isFalse();
            assertThat(storageService.isComplete(full)).isTrue();
            assertThat(storageService.isComplete(tempDir.resolve("missing.ts"))).isFalse();
            assertThat(storageService.isComplete(tempDir)).isFalse();
        }
    }
}
