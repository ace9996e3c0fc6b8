package com.example.vidstream.service;

import com.example.vidstream.TestFixtures;
import com.example.vidstream.domain.TranscodeJob;
import com.example.vidstream.domain.TranscodeJob.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("JobDispatcher Tests")
class JobDispatcherTest {

    @TempDir
    Path tempDir;

    @Mock
    private JobStatusUpdater statusUpdater;
    @Mock
    private TranscodeWorker worker;
    @Mock
    private TaskExecutor workerExecutor;

    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        // two worker slots
        dispatcher = new JobDispatcher(statusUpdater, worker, workerExecutor, TestFixtures.properties(tempDir));
    }

    private static TranscodeJob running(Long id) {
        return TestFixtures.job(id, 42L, "p" + id, JobStatus.RUNNING, 1);
    }

    @Test
    @DisplayName("✅ pump: Should claim no more jobs than there are worker slots")
    void pump_RespectsCapacity() {
        given(statusUpdater.claimNext(any(Instant.class)))
                .willReturn(Optional.of(running(1L)), Optional.of(running(2L)), Optional.of(running(3L)));

        dispatcher.pump();

        then(workerExecutor).should(times(2)).execute(any(Runnable.class));
        then(statusUpdater).should(times(2)).claimNext(any(Instant.class));
        assertThat(dispatcher.inFlightJobIds()).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    @DisplayName("✅ pump: A finished job should free its slot and pull the next one")
    void run_FreesSlotAndPumps() {
        TranscodeJob first = running(1L);
        given(statusUpdater.claimNext(any(Instant.class)))
                .willReturn(Optional.of(first), Optional.empty(), Optional.of(running(2L)), Optional.empty());

        dispatcher.pump();
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        then(workerExecutor).should().execute(task.capture());

        task.getValue().run();

        then(worker).should().process(first);
        assertThat(dispatcher.inFlightJobIds()).containsExactly(2L);
        then(workerExecutor).should(times(2)).execute(any(Runnable.class));
    }

    @Test
    @DisplayName("⚠️ pump: A rejected job should be released back to the queue")
    void pump_Rejected_Released() {
        given(statusUpdater.claimNext(any(Instant.class))).willReturn(Optional.of(running(1L)), Optional.empty());
        willThrow(new TaskRejectedException("pool full")).given(workerExecutor).execute(any(Runnable.class));

        dispatcher.pump();

        then(statusUpdater).should().release(eq(1L), any());
        assertThat(dispatcher.inFlightJobIds()).isEmpty();
    }

    @Test
    @DisplayName("⚠️ pump: A database failure while claiming should stop this round quietly")
    void pump_ClaimFails() {
        given(statusUpdater.claimNext(any(Instant.class))).willThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(() -> dispatcher.pump()).doesNotThrowAnyException();
        then(workerExecutor).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("✅ recoverExpiredLeases: Should exclude jobs executing here and pump after a requeue")
    void recover_ExcludesInFlight() {
        given(statusUpdater.claimNext(any(Instant.class))).willReturn(Optional.of(running(1L)), Optional.empty());
        dispatcher.pump();
        given(statusUpdater.requeueExpiredLeases(any(Instant.class), anySet()))
                .willReturn(List.of(TestFixtures.job(9L, 43L, "480p", JobStatus.QUEUED, 1)));

        dispatcher.recoverExpiredLeases();

        ArgumentCaptor<Set<Long>> inFlight = ArgumentCaptor.forClass(Set.class);
        then(statusUpdater).should().requeueExpiredLeases(any(Instant.class), inFlight.capture());
        assertThat(inFlight.getValue()).containsExactly(1L);
        then(statusUpdater).should(times(3)).claimNext(any(Instant.class));
    }
}
