package com.dataPlatform.platformFacade.facade.normalization;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts platform result objects into JSON-safe values.
 *
 * Output is built only from null, Boolean, Number, String, List and
 * String-keyed Map, so it can be cached and serialized as-is. Lists and maps in the
 * output are unmodifiable at every level.
 *
 * Dispatch (first match wins):
 * - null
 * - Boolean, Number, String (Character becomes a one-char String)
 * - Collection or array, element-wise, order preserved
 * - Map, keys rendered as strings
 * - timestamp-like: java.time types, Date, {@link IsoFormattable}
 * - enumeration-like: Enum, {@link Named}
 * - value-like: Optional, {@link ValueCarrier}
 * - anything else: String.valueOf
 */
@Slf4j
@Component
public class ObjectNormalizer {

    /**
     * Nesting limit for acyclic input.
     */
    public static final int MAX_DEPTH = 64;

    /**
     * Replaces values past {@link #MAX_DEPTH} and containers that contain themselves.
     */
    public static final String DEPTH_EXCEEDED = "[max depth exceeded]";

    /**
     * Normalizes any value into a JSON-safe tree.
     *
     * @param value Value returned by the platform client (may be null)
     * @return Normalized value
     */
    public Object normalize(Object value) {
        return new Traversal().normalize(value, 0);
    }

    /**
     * Normalizes an ordered field map, keeping field order.
     * Used by the facade services to build operation payloads.
     *
     * @param fields Field name to raw value
     * @return Unmodifiable normalized map
     */
    public Map<String, Object> normalizeFields(Map<String, ?> fields) {
        Traversal traversal = new Traversal();
        Map<String, Object> normalized = new LinkedHashMap<>();
        fields.forEach((key, raw) -> normalized.put(key, traversal.normalize(raw, 1)));
        return Collections.unmodifiableMap(normalized);
    }

    /**
     * State of one normalize call. A container reached a second time reuses its first
     * result, and a container reached from inside itself becomes {@link #DEPTH_EXCEEDED},
     * so work stays linear in the number of distinct containers.
     */
    private static final class Traversal {

        private final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Map<Object, Object> completed = new IdentityHashMap<>();

        Object normalize(Object value, int depth) {
            if (value == null) {
                return null;
            }
            if (depth > MAX_DEPTH) {
                log.warn("Normalization depth limit reached - type: {}", value.getClass().getName());
                return DEPTH_EXCEEDED;
            }

            if (value instanceof Boolean || value instanceof Number || value instanceof String) {
                return value;
            }
            if (value instanceof Character character) {
                return character.toString();
            }

            if (value instanceof Collection<?> || value instanceof Map<?, ?> || value.getClass().isArray()) {
                return normalizeContainer(value, depth);
            }

            if (value instanceof TemporalAccessor || value instanceof Date || value instanceof IsoFormattable) {
                return toIsoString(value);
            }

            if (value instanceof Enum<?> constant) {
                return constant.name();
            }
            if (value instanceof Named named) {
                return named.getName();
            }

            if (value instanceof Optional<?> optional) {
                return normalize(optional.orElse(null), depth + 1);
            }
            if (value instanceof ValueCarrier carrier) {
                return normalize(carrier.getValue(), depth + 1);
            }

            return String.valueOf(value);
        }

        private Object normalizeContainer(Object container, int depth) {
            if (completed.containsKey(container)) {
                return completed.get(container);
            }
            if (!inProgress.add(container)) {
                log.warn("Cyclic reference replaced - type: {}", container.getClass().getName());
                return DEPTH_EXCEEDED;
            }

            Object result;
            if (container instanceof Map<?, ?> map) {
                Map<String, Object> normalized = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    normalized.put(String.valueOf(entry.getKey()), normalize(entry.getValue(), depth + 1));
                }
                result = Collections.unmodifiableMap(normalized);
            } else {
                List<Object> items = new ArrayList<>();
                for (Object item : elements(container)) {
                    items.add(normalize(item, depth + 1));
                }
                result = Collections.unmodifiableList(items);
            }

            inProgress.remove(container);
            completed.put(container, result);
            return result;
        }
    }

    /**
     * Elements of a collection or array, boxed for primitive arrays.
     */
    private static Iterable<?> elements(Object container) {
        if (container instanceof Collection<?> collection) {
            return collection;
        }
        if (container instanceof Object[] objects) {
            return Arrays.asList(objects);
        }
        if (container instanceof int[] ints) {
            return Arrays.stream(ints).boxed().toList();
        }
        if (container instanceof long[] longs) {
            return Arrays.stream(longs).boxed().toList();
        }
        if (container instanceof double[] doubles) {
            return Arrays.stream(doubles).boxed().toList();
        }
        List<Object> boxed = new ArrayList<>();
        if (container instanceof byte[] bytes) {
            for (byte b : bytes) {
                boxed.add(b);
            }
        } else if (container instanceof short[] shorts) {
            for (short s : shorts) {
                boxed.add(s);
            }
        } else if (container instanceof float[] floats) {
            for (float f : floats) {
                boxed.add(f);
            }
        } else if (container instanceof char[] chars) {
            for (char c : chars) {
                boxed.add(c);
            }
        } else if (container instanceof boolean[] booleans) {
            for (boolean b : booleans) {
                boxed.add(b);
            }
        }
        return boxed;
    }

    private static String toIsoString(Object value) {
        if (value instanceof IsoFormattable formattable) {
            return formattable.toIsoString();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (value instanceof Date date) {
            // java.sql.Date rejects toInstant()
            return Instant.ofEpochMilli(date.getTime()).toString();
        }
        // Instant, LocalDate, LocalDateTime, OffsetDateTime: toString is ISO-8601
        return value.toString();
    }
}
