package xyz.vvrf.reactor.workflow.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流数据包的深拷贝工具。
 * 递归复制 Map 和 Collection (集合统一复制为 ArrayList)，其余值按引用共享，视为不可变。
 */
public final class DataCopies {

    private DataCopies() {}

    /**
     * 深拷贝一个字符串键的数据包。保持插入顺序。
     *
     * @param source 源数据 (可以为 null)
     * @return 新的可变 LinkedHashMap，source 为 null 时返回空 Map
     */
    public static Map<String, Object> deepCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
        }
        return copy;
    }

    /**
     * 深拷贝单个值。
     */
    @SuppressWarnings("unchecked")
    public static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
                copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
            for (Object element : (Collection<?>) value) {
                copy.add(deepCopyValue(element));
            }
            return copy;
        }
        return value;
    }
}
