package no.cantara.cargo;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Renders a raw document tree as TOML text.
 *
 * <p>Within each table, plain keys are written first, then sub-tables as {@code [a.b]}
 * sections, then arrays of tables as {@code [[a.b]]} sections. Empty tables still get a
 * header so they survive a round trip. {@code null} values are skipped.
 */
public final class TomlWriter {

    private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z0-9_-]+");

    private TomlWriter() {}

    public static String write(Map<String, ?> document) {
        StringBuilder out = new StringBuilder();
        writeTable(out, List.of(), document);
        return out.toString();
    }

    private static void writeTable(StringBuilder out, List<String> path, Map<String, ?> table) {
        for (Map.Entry<String, ?> e : table.entrySet()) {
            Object value = e.getValue();
            if (value == null || value instanceof Map<?, ?> || isArrayOfTables(value)) continue;
            out.append(key(e.getKey())).append(" = ").append(inline(value)).append('\n');
        }
        for (Map.Entry<String, ?> e : table.entrySet()) {
            if (e.getValue() instanceof Map<?, ?> child) {
                List<String> childPath = child(path, e.getKey());
                separate(out);
                out.append('[').append(dotted(childPath)).append("]\n");
                writeTable(out, childPath, asTable(child));
            }
        }
        for (Map.Entry<String, ?> e : table.entrySet()) {
            if (isArrayOfTables(e.getValue())) {
                List<String> childPath = child(path, e.getKey());
                for (Object item : (List<?>) e.getValue()) {
                    separate(out);
                    out.append("[[").append(dotted(childPath)).append("]]\n");
                    writeTable(out, childPath, asTable((Map<?, ?>) item));
                }
            }
        }
    }

    private static boolean isArrayOfTables(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) return false;
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) return false;
        }
        return true;
    }

    static String inline(Object value) {
        if (value instanceof String s) return quote(s);
        if (value instanceof Boolean b) return b.toString();
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) return formatFloat(((Number) value).doubleValue());
        if (value instanceof BigDecimal d) return d.toString();
        if (value instanceof LocalDate d) return d.toString();
        if (value instanceof LocalTime t) return DateTimeFormatter.ISO_LOCAL_TIME.format(t);
        if (value instanceof LocalDateTime t) return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(t);
        if (value instanceof OffsetDateTime t) return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(t);
        if (value instanceof Map<?, ?> map) {
            if (map.isEmpty()) return "{}";
            StringJoiner joiner = new StringJoiner(", ", "{ ", " }");
            map.forEach((k, v) -> {
                if (v != null) joiner.add(key(String.valueOf(k)) + " = " + inline(v));
            });
            return joiner.toString();
        }
        if (value instanceof List<?> list) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object item : list) {
                if (item != null) joiner.add(inline(item));
            }
            return joiner.toString();
        }
        throw new IllegalArgumentException("Cannot write TOML value of type " + value.getClass().getName());
    }

    private static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        return Double.toString(d);
    }

    static String key(String key) {
        return BARE_KEY.matcher(key).matches() ? key : quote(key);
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"'  -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                case '\f' -> sb.append("\\f");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static String dotted(List<String> path) {
        StringJoiner joiner = new StringJoiner(".");
        path.forEach(p -> joiner.add(key(p)));
        return joiner.toString();
    }

    private static List<String> child(List<String> path, String key) {
        List<String> childPath = new ArrayList<>(path);
        childPath.add(key);
        return childPath;
    }

    private static void separate(StringBuilder out) {
        if (out.length() > 0) out.append('\n');
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asTable(Map<?, ?> map) {
        return (Map<String, ?>) map;
    }
}
