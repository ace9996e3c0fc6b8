package com.example.vidstream.service;

import com.example.vidstream.exceptions.FfmpegProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EncoderFailureClassifier Tests")
class EncoderFailureClassifierTest {

    private final EncoderFailureClassifier classifier = new EncoderFailureClassifier();

    @Test
    @DisplayName("✅ Exit by signal is transient")
    void killedBySignal_IsRetryable() {
        assertThat(classifier.isRetryable(new FfmpegProcessingException("killed", 137, ""))).isTrue();
    }

    @Test
    @DisplayName("✅ Resource exhaustion in stderr is transient")
    void resourceExhaustion_IsRetryable() {
        FfmpegProcessingException ex = new FfmpegProcessingException("failed", 1,
                "[libx264 @ 0x55] malloc of size 8294400 failed: Cannot allocate memory");
        assertThat(classifier.isRetryable(ex)).isTrue();
    }

    @Test
    @DisplayName("✅ I/O timeouts in stderr are transient")
    void ioTimeout_IsRetryable() {
        FfmpegProcessingException ex = new FfmpegProcessingException("failed", 1, "input.mp4: Connection timed out");
        assertThat(classifier.isRetryable(ex)).isTrue();
    }

    @Test
    @DisplayName("❌ Disk full is fatal even when killed")
    void diskFull_IsFatal() {
        FfmpegProcessingException ex = new FfmpegProcessingException("failed", 134,
                "av_interleaved_write_frame(): No space left on device");
        assertThat(classifier.isRetryable(ex)).isFalse();
    }

    @Test
    @DisplayName("❌ Corrupt input is fatal")
    void corruptInput_IsFatal() {
        FfmpegProcessingException ex = new FfmpegProcessingException("failed", 1,
                "moov atom not found\nsource.mp4: Invalid data found when processing input");
        assertThat(classifier.isRetryable(ex)).isFalse();
    }

    @Test
    @DisplayName("❌ Missing encoder binary is fatal, transient start failures are not")
    void startFailures_ClassifiedByCause() {
        assertThat(classifier.isRetryable(new FfmpegProcessingException("start",
                new IOException("Cannot run program \"ffmpeg\": error=2, No such file or directory")))).isFalse();
        assertThat(classifier.isRetryable(new FfmpegProcessingException("start",
                new IOException("error=24, Too many open files")))).isTrue();
    }
}
