package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionCleanupTaskTest {

    private final Scheduler scheduler = Schedulers.newSingle("cleanup-test");

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void runsPeriodicallyWithConfiguredRetention() {
        WorkflowExecutor executor = mock(WorkflowExecutor.class);
        Duration retention = Duration.ofMinutes(5);
        ExecutionCleanupTask task = new ExecutionCleanupTask(executor, scheduler, retention, Duration.ofMillis(20));

        task.start();
        try {
            assertThat(task.isRunning()).isTrue();
            verify(executor, timeout(2000).atLeast(2)).cleanupCompletedExecutions(retention);
        } finally {
            task.stop();
        }
        assertThat(task.isRunning()).isFalse();
    }

    @Test
    void startIsIdempotent() {
        ExecutionCleanupTask task = new ExecutionCleanupTask(mock(WorkflowExecutor.class), scheduler,
                Duration.ZERO, Duration.ofHours(1));

        task.start();
        task.start();
        assertThat(task.isRunning()).isTrue();

        task.stop();
        task.stop();
        assertThat(task.isRunning()).isFalse();
    }

    @Test
    void runOnceReturnsRemovedCount() {
        WorkflowExecutor executor = mock(WorkflowExecutor.class);
        when(executor.cleanupCompletedExecutions(any())).thenReturn(3);
        ExecutionCleanupTask task = new ExecutionCleanupTask(executor, scheduler, Duration.ZERO, Duration.ofHours(1));

        assertThat(task.runOnce()).isEqualTo(3);
    }

    @Test
    void failuresAreContained() {
        WorkflowExecutor executor = mock(WorkflowExecutor.class);
        when(executor.cleanupCompletedExecutions(any())).thenThrow(new IllegalStateException("registry unavailable"));
        ExecutionCleanupTask task = new ExecutionCleanupTask(executor, scheduler, Duration.ZERO, Duration.ofMillis(20));

        assertThat(task.runOnce()).isZero();

        task.start();
        try {
            verify(executor, timeout(2000).atLeast(3)).cleanupCompletedExecutions(any());
            assertThat(task.isRunning()).isTrue();
        } finally {
            task.stop();
        }
    }

    @Test
    void rejectsInvalidDurations() {
        WorkflowExecutor executor = mock(WorkflowExecutor.class);

        assertThatThrownBy(() -> new ExecutionCleanupTask(executor, scheduler, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExecutionCleanupTask(executor, scheduler, Duration.ofSeconds(-1), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
