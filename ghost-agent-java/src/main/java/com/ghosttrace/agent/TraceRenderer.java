package com.ghosttrace.agent;

import java.util.Map;

/**
 * Text dump of a {@link TraceSnapshot}:
 * <pre>
 * com.shop.Cart.total:
 *   qty = 3
 *   name = "pen"
 * </pre>
 */
public final class TraceRenderer {

    public static final String NO_VARIABLES = "no variables yet";

    private TraceRenderer() {}

    public static String render(TraceSnapshot snapshot) {
        if (snapshot.isEmpty()) return NO_VARIABLES;
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Map<String, String>> fn : snapshot.values().entrySet()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(fn.getKey()).append(':');
            for (Map.Entry<String, String> v : fn.getValue().entrySet()) {
                sb.append("\n  ").append(v.getKey()).append(" = ").append(v.getValue());
            }
        }
        return sb.toString();
    }
}
