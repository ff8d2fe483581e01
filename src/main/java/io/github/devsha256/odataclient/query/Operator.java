package io.github.devsha256.odataclient.query;

import java.util.Locale;

/**
 * Comparison operators allowed in a {@code $filter} clause.
 */
public enum Operator {
    EQ, NE, GT, GE, LT, LE;

    /**
     * The token as it appears on the wire, e.g. {@code eq}.
     */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Operator fromToken(String token) {
        try {
            return valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown filter operator '" + token + "'", e);
        }
    }
}
