package xyz.vvrf.reactor.workflow.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowContextTest {

    @Test
    void backgroundNeverEnds() {
        WorkflowContext background = WorkflowContext.background();

        assertThat(background.isDone()).isFalse();
        assertThat(background.getDeadline()).isEmpty();
        assertThatThrownBy(background::cancel).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancellationPropagatesToChildrenOnly() {
        WorkflowContext parent = WorkflowContext.background().withCancel();
        WorkflowContext child = parent.withValue("tenant", "acme");
        WorkflowContext sibling = WorkflowContext.background().withCancel();

        parent.cancel();

        assertThat(parent.getCancellationReason()).contains(WorkflowContext.CancellationReason.CANCELLED);
        assertThat(child.isDone()).isTrue();
        assertThat(sibling.isDone()).isFalse();
    }

    @Test
    void deadlines() {
        WorkflowContext expired = WorkflowContext.background().withDeadline(Instant.now().minusMillis(1));
        WorkflowContext later = WorkflowContext.background().withTimeout(Duration.ofHours(1));

        assertThat(expired.getCancellationReason()).contains(WorkflowContext.CancellationReason.DEADLINE_EXCEEDED);
        assertThat(later.isDone()).isFalse();

        later.cancel();
        assertThat(later.getCancellationReason()).contains(WorkflowContext.CancellationReason.CANCELLED);
    }

    @Test
    void earliestDeadlineWins() {
        Instant soon = Instant.now().plusSeconds(60);
        Instant far = soon.plusSeconds(3600);

        WorkflowContext ctx = WorkflowContext.background().withDeadline(soon).withDeadline(far);

        assertThat(ctx.getDeadline()).contains(soon);
    }

    @Test
    void valuesResolveThroughAncestors() {
        WorkflowContext ctx = WorkflowContext.background()
                .withValue("tenant", "acme")
                .withCancel()
                .withValue("tenant", "globex")
                .withValue("trace", 7);

        assertThat(ctx.getValue("tenant")).contains("globex");
        assertThat(ctx.getValue("trace")).contains(7);
        assertThat(ctx.getValue("missing")).isEmpty();
    }
}
