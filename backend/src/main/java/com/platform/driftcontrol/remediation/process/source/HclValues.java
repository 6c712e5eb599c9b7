package com.platform.driftcontrol.remediation.process.source;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conversion between JSON-shaped values and HCL literals.
 * 
 * Scalars round-trip: integral literals parse to {@link Integer}, {@link Long} or
 * {@link BigInteger} (the narrowest that fits), decimals to {@link Double}.
 */
public final class HclValues {
    
    private HclValues() {
    }
    
    public static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Boolean b) {
            return b.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("HCL has no literal for " + d);
            }
            return Double.toString(d);
        }
        if (value instanceof BigDecimal decimal) {
            String plain = decimal.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Collection<?> items) {
            return items.stream()
                .map(HclValues::format)
                .collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .map(e -> quote(String.valueOf(e.getKey())) + " = " + format(e.getValue()))
                .collect(Collectors.joining(", ", "{ ", " }"));
        }
        return quote(value.toString());
    }
    
    /**
     * Parse a scalar literal as produced by {@link #format}.
     *
     * @throws IllegalArgumentException for anything that is not a scalar literal
     */
    public static Object parse(String literal) {
        String text = literal.strip();
        if (text.equals("null")) {
            return null;
        }
        if (text.equals("true") || text.equals("false")) {
            return Boolean.valueOf(text);
        }
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return unquote(text.substring(1, text.length() - 1));
        }
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return Double.valueOf(text);
            }
            BigInteger integer = new BigInteger(text);
            if (integer.bitLength() < 32) {
                return integer.intValue();
            }
            if (integer.bitLength() < 64) {
                return integer.longValue();
            }
            return integer;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an HCL scalar literal: " + literal, e);
        }
    }
    
    static String quote(String s) {
        StringBuilder out = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '$', '%' -> {
                    // template sequences ${ and %{ are escaped by doubling the sigil
                    out.append(c);
                    if (i + 1 < s.length() && s.charAt(i + 1) == '{') {
                        out.append(c);
                    }
                }
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }
    
    static String unquote(String body) {
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> out.append('\n');
                    case 'r' -> out.append('\r');
                    case 't' -> out.append('\t');
                    default -> out.append(next);
                }
            } else if ((c == '$' || c == '%') && i + 2 < body.length()
                && body.charAt(i + 1) == c && body.charAt(i + 2) == '{') {
                out.append(c);
                i++;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
