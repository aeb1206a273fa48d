package io.buslink.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Casts wire values back into the types a listener declared.
 *
 * <p>Casting is best-effort: a value that cannot be converted is passed through unchanged
 * and a warning is logged, so a listener never fails just because one argument arrived in
 * an unexpected shape.
 */
public final class ValueCaster {
    private static final Logger logger = Logger.getLogger(ValueCaster.class.getName());

    private ValueCaster() {
    }

    /**
     * Casts each value whose name appears in {@code types}; other values are kept as-is.
     *
     * @param kwargs the received keyword arguments
     * @param types  declared parameter types by name
     * @return a new map in the original key order
     */
    public static Map<String, Object> castAll(Map<String, Object> kwargs, Map<String, Class<?>> types) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : kwargs.entrySet()) {
            Class<?> type = types.get(entry.getKey());
            result.put(entry.getKey(), type == null ? entry.getValue() : cast(entry.getValue(), type));
        }
        return result;
    }

    public static Object cast(Object value, Class<?> type) {
        if (value == null || type == Object.class) {
            return value;
        }
        Class<?> target = boxed(type);
        if (target.isInstance(value)) {
            return value;
        }
        try {
            Object cast = convert(value, target);
            if (cast != null) {
                return cast;
            }
        } catch (IllegalArgumentException | DateTimeParseException | ArithmeticException e) {
            logger.log(Level.WARNING, "Failed to cast value " + value + " to " + target.getSimpleName()
                    + ", passing it through unchanged", e);
            return value;
        }
        logger.fine(() -> "No cast from " + value.getClass().getSimpleName() + " to " + target.getSimpleName());
        return value;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convert(Object value, Class<?> target) {
        String text = String.valueOf(value);
        if (target == String.class) {
            return text;
        }
        if (target == Integer.class) {
            return value instanceof Number n ? Integer.valueOf(exact(n).intValueExact()) : Integer.valueOf(text.trim());
        }
        if (target == Long.class) {
            return value instanceof Number n ? Long.valueOf(exact(n).longValueExact()) : Long.valueOf(text.trim());
        }
        if (target == Short.class) {
            return value instanceof Number n ? Short.valueOf(exact(n).shortValueExact()) : Short.valueOf(text.trim());
        }
        if (target == Double.class) {
            return value instanceof Number n ? Double.valueOf(finite(n.doubleValue(), n)) : Double.valueOf(text.trim());
        }
        if (target == Float.class) {
            return value instanceof Number n ? Float.valueOf((float) finite(n.floatValue(), n)) : Float.valueOf(text.trim());
        }
        if (target == BigDecimal.class) {
            return new BigDecimal(text.trim());
        }
        if (target == BigInteger.class) {
            return new BigInteger(text.trim());
        }
        if (target == Boolean.class) {
            return toBoolean(value, text);
        }
        if (target == UUID.class) {
            return UUID.fromString(text);
        }
        if (target == Instant.class) {
            return Instant.parse(text);
        }
        if (target == LocalDate.class) {
            return LocalDate.parse(text);
        }
        if (target == LocalDateTime.class) {
            return LocalDateTime.parse(text);
        }
        if (target == LocalTime.class) {
            return LocalTime.parse(text);
        }
        if (target == OffsetDateTime.class) {
            return OffsetDateTime.parse(text);
        }
        if (target == ZonedDateTime.class) {
            return ZonedDateTime.parse(text);
        }
        if (target == Duration.class) {
            return Duration.parse(text);
        }
        if (target.isEnum()) {
            return Enum.valueOf((Class<? extends Enum>) target, text);
        }
        return null;
    }

    private static BigDecimal exact(Number n) {
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ArithmeticException("Not a finite number: " + n);
            }
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(n.longValue());
    }

    // narrowing to float or double may overflow to infinity
    private static double finite(double converted, Number original) {
        boolean infiniteSource = (original instanceof Double || original instanceof Float)
                && Double.isInfinite(original.doubleValue());
        if (Double.isInfinite(converted) && !infiniteSource) {
            throw new ArithmeticException(original + " is out of range");
        }
        return converted;
    }

    private static Boolean toBoolean(Object value, String text) {
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        String normalised = text.trim().toLowerCase();
        if (normalised.equals("true") || normalised.equals("1") || normalised.equals("yes")) {
            return Boolean.TRUE;
        }
        if (normalised.equals("false") || normalised.equals("0") || normalised.equals("no")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + text);
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == boolean.class) return Boolean.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return type;
    }
}
