package com.dcarunner.scheduling;

import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.failure.ScheduleDisabledException;
import com.dcarunner.failure.Disposition;
import com.dcarunner.scheduling.config.SchedulerProperties;
import com.dcarunner.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DueOperationPollerTest {

    @Mock private JobStore jobStore;
    @Mock private OperationFireHandler fireHandler;

    private SchedulerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        properties.setBatchSize(10);
        when(jobStore.listDue(any(), eq(10))).thenReturn(List.of(job("a"), job("b")));
    }

    @Test
    @DisplayName("every due job is handed to the fire handler")
    void dispatchesDueJobs() {
        poller(Runnable::run).pollDue();

        verify(fireHandler).fire("a");
        verify(fireHandler).fire("b");
    }

    @Test
    @DisplayName("a failing fire does not stop the rest of the batch")
    void failureDoesNotStopBatch() {
        when(fireHandler.fire("a")).thenThrow(new ScheduleDisabledException("a", OperationKind.TRANSFER,
                Disposition.FATAL, new IllegalStateException("boom")));

        poller(Runnable::run).pollDue();

        verify(fireHandler).fire("b");
    }

    @Test
    @DisplayName("a job still running is not dispatched again")
    void skipsInFlight() {
        when(fireHandler.isInFlight("a")).thenReturn(true);

        poller(Runnable::run).pollDue();

        verify(fireHandler, never()).fire("a");
        verify(fireHandler).fire("b");
    }

    @Test
    @DisplayName("saturated pool defers the remainder of the batch")
    void saturatedPool() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("full");
        };

        poller(rejecting).pollDue();

        verify(fireHandler, never()).fire(anyString());
    }

    @Test
    @DisplayName("disabled poll loop reads nothing")
    void disabled() {
        properties.setEnabled(false);

        poller(Runnable::run).pollDue();

        verify(jobStore, never()).listDue(any(), anyInt());
        verifyNoInteractions(fireHandler);
    }

    private DueOperationPoller poller(Executor executor) {
        return new DueOperationPoller(jobStore, fireHandler, properties, executor);
    }

    private static ScheduledOperation job(String id) {
        ScheduledOperation job = new ScheduledOperation();
        job.setId(id);
        job.setKind(OperationKind.TRANSFER);
        job.setEnabled(true);
        return job;
    }
}
