package com.ciro.jwebtemplate.expr;

import com.ciro.jwebtemplate.exception.EvaluationException;
import com.ciro.jwebtemplate.json.ObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.jsoup.nodes.Node;

import java.lang.reflect.Array;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Coercions applied to the dynamic values produced by expressions: text, truthiness,
 * ordered key/value iteration and JSON.
 */
public final class TemplateValues {

    private static final ObjectMapper MAPPER = ObjectMapperFactory.create();
    private static final ObjectWriter SCRIPT_WRITER = ObjectMapperFactory.scriptSafeWriter(MAPPER);

    private TemplateValues() {}

    public static String toText(Object o) {
        return toText(o, MAPPER);
    }

    /** Text form of {@code o}; maps, collections and arrays are written as JSON by {@code mapper}. */
    public static String toText(Object o, ObjectMapper mapper) {
        if (o == null) return "";
        if (o instanceof String s) return s;
        if (o instanceof Double || o instanceof Float) return formatDecimal(((Number) o).doubleValue());
        if (o instanceof Number || o instanceof Boolean || o instanceof Character) return o.toString();
        if (o instanceof Node n) return n.outerHtml();
        if (o instanceof Map<?, ?> || o instanceof Collection<?> || o.getClass().isArray()) return toJson(o, mapper);
        return String.valueOf(o);
    }

    private static String formatDecimal(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    public static boolean isTruthy(Object o) {
        if (o == null) return false;
        if (o instanceof Boolean b) return b;
        if (o instanceof Collection<?> c) return !c.isEmpty();
        if (o instanceof String s) return !s.isEmpty();
        if (o instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (o.getClass().isArray()) return Array.getLength(o) > 0;
        return true;
    }

    /** Object-shaped values (maps) are flattened key by key by the form populator. */
    public static boolean isObjectShaped(Object o) {
        return o instanceof Map<?, ?>;
    }

    /**
     * Ordered (key, item) pairs of a collection-like value. Maps yield their entries, lists,
     * arrays and other iterables yield (index, item). {@code null} and scalars yield nothing.
     */
    public static List<Map.Entry<Object, Object>> entries(Object o) {
        if (o == null) return Collections.emptyList();
        List<Map.Entry<Object, Object>> out = new ArrayList<>();
        if (o instanceof Map<?, ?> m) {
            m.forEach((k, v) -> out.add(new AbstractMap.SimpleImmutableEntry<>(k, v)));
        } else if (o instanceof Iterable<?> it) {
            int i = 0;
            for (Object item : it) {
                out.add(new AbstractMap.SimpleImmutableEntry<>(i++, item));
            }
        } else if (o.getClass().isArray()) {
            int len = Array.getLength(o);
            for (int i = 0; i < len; i++) {
                out.add(new AbstractMap.SimpleImmutableEntry<>(i, Array.get(o, i)));
            }
        }
        return out;
    }

    public static String toJson(Object o) {
        return toJson(o, MAPPER);
    }

    public static String toJson(Object o, ObjectMapper mapper) {
        try {
            return mapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new EvaluationException("Value cannot be serialized to JSON: " + o.getClass().getName(), e);
        }
    }

    /** JSON safe to embed verbatim inside a {@code <script>} element. */
    public static String toScriptJson(Object o) {
        return toScriptJson(o, SCRIPT_WRITER);
    }

    /** As {@link #toScriptJson(Object)}, written by a writer from {@link ObjectMapperFactory#scriptSafeWriter}. */
    public static String toScriptJson(Object o, ObjectWriter scriptWriter) {
        if (o instanceof Node n) o = n.outerHtml();
        try {
            return scriptWriter.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new EvaluationException("Value cannot be serialized to JSON: " + o.getClass().getName(), e);
        }
    }

    public static double toNumber(Object o) {
        if (o == null) return 0;
        if (o instanceof Number n) return n.doubleValue();
        if (o instanceof Boolean b) return b ? 1 : 0;
        String s = toText(o).trim();
        if (s.isEmpty()) return 0;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static boolean isIntegral(Object o) {
        return o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte;
    }
}
