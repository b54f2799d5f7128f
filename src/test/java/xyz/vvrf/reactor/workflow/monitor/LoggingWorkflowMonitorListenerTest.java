package xyz.vvrf.reactor.workflow.monitor;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import xyz.vvrf.reactor.workflow.core.NodeOutput;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.exception.NodeExecutionException;
import xyz.vvrf.reactor.workflow.test.util.TestNode;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingWorkflowMonitorListenerTest {

    private final LoggingWorkflowMonitorListener listener = new LoggingWorkflowMonitorListener();
    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingWorkflowMonitorListener.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void logsLifecycleAtInfo() {
        listener.onWorkflowStart("exec-1", "wf", "start");
        listener.onNodeStart("exec-1", "wf", "start", TestNode.builder("start").build());
        listener.onNodeSuccess("exec-1", "wf", "start", Duration.ofMillis(3), NodeOutput.routeTo("next"));
        listener.onWorkflowComplete("exec-1", "wf", WorkflowStatus.COMPLETED, Duration.ofMillis(5), null);

        assertThat(appender.list).hasSize(4).allMatch(event -> event.getLevel() == Level.INFO);
        assertThat(appender.list.get(0).getFormattedMessage()).contains("[MONITOR]", "exec-1", "wf", "start");
        assertThat(appender.list.get(2).getFormattedMessage()).contains("next");
        assertThat(appender.list.get(3).getFormattedMessage()).contains("completed");
    }

    @Test
    void logsFailuresAtError() {
        NodeExecutionException failure = new NodeExecutionException("a", new IllegalStateException("boom"));

        listener.onWorkflowComplete("exec-1", "wf", WorkflowStatus.FAILED, Duration.ZERO, failure);

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.ERROR);
            assertThat(event.getFormattedMessage()).contains("node a execution failed");
        });
    }
}
