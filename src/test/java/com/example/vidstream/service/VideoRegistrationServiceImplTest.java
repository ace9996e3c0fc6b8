package com.example.vidstream.service;

import com.example.vidstream.TestFixtures;
import com.example.vidstream.domain.Video;
import com.example.vidstream.events.VideoRegisteredEvent;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.repository.VideoRepository;
import com.example.vidstream.service.impl.FilesystemVideoStorageServiceImpl;
import com.example.vidstream.service.impl.VideoRegistrationServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("VideoRegistrationServiceImpl Tests")
class VideoRegistrationServiceImplTest {

    @TempDir
    Path tempDir;

    @Mock
    private VideoRepository videoRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private VideoRegistrationServiceImpl registrationService;

    @BeforeEach
    void setUp() {
        FilesystemVideoStorageServiceImpl storage = new FilesystemVideoStorageServiceImpl(
                tempDir.resolve("src").toString(), TestFixtures.properties(tempDir.resolve("hls")));
        ReflectionTestUtils.invokeMethod(storage, "initialize");
        registrationService = new VideoRegistrationServiceImpl(videoRepository, storage, eventPublisher);
    }

    @Test
    @DisplayName("✅ register: Should save the video and publish a registration event")
    void register_Success() throws Exception {
        Files.writeString(tempDir.resolve("src").resolve("clip.mp4"), "source");
        given(videoRepository.save(any(Video.class))).willReturn(TestFixtures.video(42L, "clip.mp4"));

        Video video = registrationService.register("Clip", "clip.mp4");

        assertThat(video.getId()).isEqualTo(42L);
        ArgumentCaptor<VideoRegisteredEvent> captor = ArgumentCaptor.forClass(VideoRegisteredEvent.class);
        then(eventPublisher).should().publishEvent(captor.capture());
        assertThat(captor.getValue().getVideoId()).isEqualTo(42L);
        assertThat(captor.getValue().getSourcePath()).isEqualTo("clip.mp4");
    }

    @Test
    @DisplayName("❌ register: Should refuse a source that does not exist")
    void register_MissingSource_NotFound() {
        assertThatThrownBy(() -> registrationService.register("Clip", "missing.mp4"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing.mp4");

        then(videoRepository).shouldHaveNoInteractions();
        then(eventPublisher).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("❌ register: Should reject a source path outside the source root as a bad request")
    void register_Traversal_BadRequest() {
        assertThatThrownBy(() -> registrationService.register("Clip", "../secrets.mp4"))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));

        then(videoRepository).shouldHaveNoInteractions();
    }
}
