package com.ghosttrace.agent;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders an arbitrary Java value to a compact one-line string.
 *
 * Rules:
 * - null: {@code null}
 * - String: double-quoted; Character: single-quoted
 * - other scalars and enums: {@code String.valueOf}
 * - arrays and collections: {@code [a, b, c, ...+N]}, truncated at maxElements
 * - maps: {@code {k=v, ...+N}}
 * - POJOs: {@code Type{field=value, ...}} over declared and inherited instance fields
 * - depth limit: a non-scalar at depth >= maxDepth renders as {@code <Type>}
 * - cycles: {@code <circular>}
 */
public final class ValueSerializer {

    private ValueSerializer() {}

    public static String render(Object value, RenderLimits limits) {
        StringBuilder out = new StringBuilder();
        renderInto(value, limits, 0, out, new IdentityHashMap<>());
        return out.toString();
    }

    private static void renderInto(
            Object obj,
            RenderLimits limits,
            int depth,
            StringBuilder out,
            IdentityHashMap<Object, Boolean> visited) {

        if (obj == null) {
            out.append("null");
            return;
        }

        Class<?> cls = obj.getClass();

        if (obj instanceof String s) {
            out.append('"').append(s).append('"');
            return;
        }
        if (obj instanceof Character c) {
            out.append('\'').append(c).append('\'');
            return;
        }
        if (isScalar(cls)) {
            out.append(obj);
            return;
        }

        if (visited.containsKey(obj)) {
            out.append("<circular>");
            return;
        }

        if (depth >= limits.maxDepth()) {
            out.append('<').append(typeName(cls)).append('>');
            return;
        }

        visited.put(obj, Boolean.TRUE);
        try {
            if (cls.isArray()) {
                List<Object> elements = new ArrayList<>();
                int len = Array.getLength(obj);
                for (int i = 0; i < Math.min(len, limits.maxElements()); i++) {
                    elements.add(Array.get(obj, i));
                }
                renderSequence(elements, len, limits, depth, out, visited);
            } else if (obj instanceof Collection<?> col) {
                List<Object> elements = new ArrayList<>();
                for (Object elem : col) {
                    if (elements.size() >= limits.maxElements()) break;
                    elements.add(elem);
                }
                renderSequence(elements, col.size(), limits, depth, out, visited);
            } else if (obj instanceof Map<?, ?> map) {
                renderMap(map, limits, depth, out, visited);
            } else {
                renderPojo(obj, cls, limits, depth, out, visited);
            }
        } finally {
            visited.remove(obj);
        }
    }

    private static void renderSequence(
            List<Object> elements,
            int total,
            RenderLimits limits,
            int depth,
            StringBuilder out,
            IdentityHashMap<Object, Boolean> visited) {

        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Object elem : elements) {
            StringBuilder sb = new StringBuilder();
            renderInto(elem, limits, depth + 1, sb, visited);
            joiner.add(sb);
        }
        if (total > elements.size()) {
            joiner.add("...+" + (total - elements.size()));
        }
        out.append(joiner);
    }

    private static void renderMap(
            Map<?, ?> map,
            RenderLimits limits,
            int depth,
            StringBuilder out,
            IdentityHashMap<Object, Boolean> visited) {

        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        int count = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (count >= limits.maxElements()) break;
            StringBuilder sb = new StringBuilder();
            renderInto(entry.getKey(), limits, depth + 1, sb, visited);
            sb.append('=');
            renderInto(entry.getValue(), limits, depth + 1, sb, visited);
            joiner.add(sb);
            count++;
        }
        if (map.size() > count) {
            joiner.add("...+" + (map.size() - count));
        }
        out.append(joiner);
    }

    private static void renderPojo(
            Object obj,
            Class<?> cls,
            RenderLimits limits,
            int depth,
            StringBuilder out,
            IdentityHashMap<Object, Boolean> visited) {

        List<Field> fields = new ArrayList<>();
        for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (f.isSynthetic() || Modifier.isStatic(f.getModifiers())) continue;
                fields.add(f);
            }
        }

        StringJoiner joiner = new StringJoiner(", ", typeName(cls) + "{", "}");
        for (Field field : fields) {
            try {
                field.setAccessible(true);
            } catch (RuntimeException e) {
                // JDK-internal fields stay closed to reflection; leave them out.
                continue;
            }
            StringBuilder sb = new StringBuilder(field.getName()).append('=');
            try {
                renderInto(field.get(obj), limits, depth + 1, sb, visited);
            } catch (IllegalAccessException e) {
                sb.append("<inaccessible>");
            }
            joiner.add(sb);
        }
        out.append(joiner);
    }

    private static String typeName(Class<?> cls) {
        String simple = cls.getSimpleName();
        return simple.isEmpty() ? cls.getName() : simple;
    }

    static boolean isScalar(Class<?> cls) {
        return cls.isPrimitive()
            || cls == Boolean.class
            || cls == Byte.class
            || cls == Short.class
            || cls == Integer.class
            || cls == Long.class
            || cls == Float.class
            || cls == Double.class
            || cls.isEnum()
            || Number.class.isAssignableFrom(cls) && cls.getPackageName().startsWith("java.");
    }
}
