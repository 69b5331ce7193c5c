package com.example.cmdpalette.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declared type of a command parameter. Arguments always arrive as strings;
 * the type only decides whether a given string is acceptable.
 */
public enum ParameterType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean");

    private static final Pattern RADIX_LITERAL =
            Pattern.compile("0[xX][0-9a-fA-F]+|0[bB][01]+|0[oO][0-7]+");

    private static final Set<String> BOOLEAN_TOKENS = Set.of("true", "false", "1", "0", "yes", "no");

    private final String label;

    ParameterType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Check whether a raw argument satisfies this type.
     */
    public boolean accepts(String value) {
        if (value == null) return false;
        switch (this) {
            case NUMBER:
                return isNumeric(value.trim());
            case BOOLEAN:
                return BOOLEAN_TOKENS.contains(value.toLowerCase(Locale.ROOT));
            case STRING:
            default:
                return true;
        }
    }

    private static boolean isNumeric(String value) {
        if (value.isEmpty()) return false;
        if (RADIX_LITERAL.matcher(value).matches()) return true;
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException e) {
            return value.equals("Infinity") || value.equals("+Infinity") || value.equals("-Infinity");
        }
    }

    /**
     * Resolve a label such as "number" (case-insensitive).
     *
     * @throws IllegalArgumentException if the label names no type
     */
    public static ParameterType fromLabel(String label) {
        for (ParameterType t : values()) {
            if (t.label.equalsIgnoreCase(label)) return t;
        }
        throw new IllegalArgumentException("Unknown parameter type: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
