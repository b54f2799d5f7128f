package xyz.vvrf.reactor.workflow.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.Edge;
import xyz.vvrf.reactor.workflow.exception.InvalidGraphException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphUtilsTest {

    private static Map<String, List<Edge>> edges(Edge... all) {
        Map<String, List<Edge>> grouped = new LinkedHashMap<>();
        for (Edge edge : all) {
            grouped.computeIfAbsent(edge.getFromNode(), k -> new ArrayList<>()).add(edge);
        }
        return grouped;
    }

    @Test
    void diamondHasNoCycle() {
        Map<String, List<Edge>> diamond = edges(Edge.of("a", "b"), Edge.of("a", "c"), Edge.of("b", "d"), Edge.of("c", "d"));

        assertThatCode(() -> GraphUtils.detectCycles(Arrays.asList("a", "b", "c", "d"), diamond, "wf"))
                .doesNotThrowAnyException();
    }

    @Test
    void detectsIndirectCycle() {
        Map<String, List<Edge>> loop = edges(Edge.of("a", "b"), Edge.of("b", "c"), Edge.of("c", "a"));

        assertThatThrownBy(() -> GraphUtils.detectCycles(Arrays.asList("a", "b", "c"), loop, "wf"))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessageContaining("cycle detected")
                .hasMessageContaining("'c' to 'a'");
    }

    @Test
    void reachabilityFollowsStaticEdges() {
        Map<String, List<Edge>> graph = edges(Edge.of("a", "b"), Edge.of("b", "c"), Edge.of("x", "c"));

        assertThat(GraphUtils.findReachable("a", graph)).containsExactly("a", "b", "c");
        assertThat(GraphUtils.findReachable("", graph)).isEmpty();
    }
}
