package xyz.vvrf.reactor.workflow.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataCopiesTest {

    @Test
    void copiesNestedContainers() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("tags", Arrays.asList("a", "b"));
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("inner", inner);
        source.put("set", new HashSet<>(Collections.singleton(1)));
        source.put("plain", "value");

        Map<String, Object> copy = DataCopies.deepCopy(source);

        assertThat(copy).isEqualTo(Map.of("inner", inner, "set", List.of(1), "plain", "value"));
        assertThat(copy.get("inner")).isNotSameAs(inner);
        assertThat(copy.get("set")).isInstanceOf(List.class);
        copy.put("added", 1);
        assertThat(source).doesNotContainKey("added");
    }

    @Test
    void nullSourceGivesEmptyMap() {
        assertThat(DataCopies.deepCopy(null)).isEmpty();
        assertThat(DataCopies.deepCopyValue(null)).isNull();
    }
}
