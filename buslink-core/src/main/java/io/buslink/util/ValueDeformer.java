package io.buslink.util;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts argument values into wire-safe form before they leave the client.
 *
 * <p>The result only contains {@code null}, strings, booleans, integral and floating point
 * numbers, lists and maps with string keys. Decimal, temporal, UUID and enum values become
 * strings; records become maps of their components; byte arrays become Base64 strings.
 * Anything else falls back to {@link String#valueOf(Object)}.
 */
public final class ValueDeformer {

    private ValueDeformer() {
    }

    public static Map<String, Object> deformKwargs(Map<String, ?> kwargs) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : kwargs.entrySet()) {
            result.put(entry.getKey(), deform(entry.getValue()));
        }
        return result;
    }

    public static Object deform(Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Double
                || value instanceof Float
                || value instanceof BigInteger) {
            return value;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Character || value instanceof UUID
                || value instanceof TemporalAccessor || value instanceof Duration) {
            return value.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                result.put(String.valueOf(entry.getKey()), deform(entry.getValue()));
            }
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            for (Object item : collection) {
                result.add(deform(item));
            }
            return result;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> result = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                result.add(deform(Array.get(value, i)));
            }
            return result;
        }
        if (value instanceof Record record) {
            return deformRecord(record);
        }
        return String.valueOf(value);
    }

    private static Map<String, Object> deformRecord(Record record) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            try {
                result.put(component.getName(), deform(component.getAccessor().invoke(record)));
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new IllegalArgumentException(
                        "Cannot read component " + component.getName() + " of " + record.getClass().getName(), e);
            }
        }
        return result;
    }
}
