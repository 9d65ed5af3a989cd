package com.agenttrace.core.instrument;

import java.lang.reflect.RecordComponent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shapes a return value into an output map:
 * a map keeps its entries, a record contributes one entry per component, anything else is stored
 * under {@code "return_value"}.
 */
final class ReturnValues {

    static final String RETURN_VALUE = "return_value";

    private ReturnValues() {}

    static Map<String, Object> format(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), v));
            return out;
        }
        if (value != null && value.getClass().isRecord()) {
            Map<String, Object> components = recordComponents((Record) value);
            if (components != null) return components;
        }
        return Collections.singletonMap(RETURN_VALUE, value);
    }

    /** Component values of {@code record}, or null if an accessor cannot be called. */
    private static Map<String, Object> recordComponents(Record record) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            try {
                var accessor = component.getAccessor();
                accessor.setAccessible(true);
                out.put(component.getName(), accessor.invoke(record));
            } catch (ReflectiveOperationException | RuntimeException e) {
                // inaccessible record: caller stores it whole
                return null;
            }
        }
        return out;
    }
}
