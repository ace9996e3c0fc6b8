package com.example.vidstream.config;

import com.example.vidstream.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.reflect.Method;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("AsyncConfig Tests")
class AsyncConfigTest {

    @TempDir
    Path tempDir;

    private AsyncConfig asyncConfig;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        asyncConfig = new AsyncConfig(TestFixtures.properties(tempDir));
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public void dummyAsyncMethod(String arg1, int arg2) {
        throw new RuntimeException("Async Test Error");
    }

    @Test
    @DisplayName("transcodeWorkerExecutor should have exactly one thread per worker slot")
    void transcodeWorkerExecutor_SizedToWorkers() {
        executor = asyncConfig.transcodeWorkerExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(2);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("transcode-");
    }

    @Test
    @DisplayName("encoderStreamExecutor should hold two drain threads per worker")
    void encoderStreamExecutor_TwoPerWorker() {
        executor = asyncConfig.encoderStreamExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("AsyncUncaughtExceptionHandler should run without error")
    void asyncUncaughtExceptionHandler_RunsWithoutError() throws NoSuchMethodException {
        AsyncUncaughtExceptionHandler handler = asyncConfig.getAsyncUncaughtExceptionHandler();
        assertThat(handler).isNotNull();

        Method testMethod = AsyncConfigTest.class.getDeclaredMethod("dummyAsyncMethod", String.class, int.class);

        assertThatCode(() -> handler.handleUncaughtException(new RuntimeException("Async Test Error"), testMethod, "param1", 123))
                .doesNotThrowAnyException();
    }
}
