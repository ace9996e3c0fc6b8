package com.example.vidstream.service;

import com.example.vidstream.exceptions.FfmpegProcessingException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a failed encoder run is worth retrying.
 * Signal exits and resource or I/O timeouts are transient; a full disk and everything else are fatal.
 */
@Component
public class EncoderFailureClassifier {

    private static final int SIGNAL_EXIT_BASE = 128;

    private static final List<String> FATAL_PATTERNS = List.of(
            "no space left on device",
            "disk quota exceeded"
    );

    private static final List<String> TRANSIENT_PATTERNS = List.of(
            "cannot allocate memory",
            "out of memory",
            "resource temporarily unavailable",
            "too many open files",
            "connection timed out",
            "operation timed out",
            "i/o timeout"
    );

    public boolean isRetryable(FfmpegProcessingException ex) {
        String diagnostics = diagnostics(ex);
        if (containsAny(diagnostics, FATAL_PATTERNS)) {
            return false;
        }
        Integer exitCode = ex.getExitCode();
        if (exitCode != null && exitCode >= SIGNAL_EXIT_BASE) {
            return true;
        }
        return containsAny(diagnostics, TRANSIENT_PATTERNS);
    }

    private static String diagnostics(FfmpegProcessingException ex) {
        StringBuilder sb = new StringBuilder();
        if (ex.getStderrOutput() != null) {
            sb.append(ex.getStderrOutput()).append('\n');
        }
        for (Throwable t = ex.getCause(); t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append('\n');
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> patterns) {
        return patterns.stream().anyMatch(text::contains);
    }
}
