package org.schemasync.script.dialect;

import java.math.BigDecimal;

/**
 * Turns a column default into the literal embedded after {@code DEFAULT}.
 * <p>
 * Bare strings are wrapped in single quotes unless they already start and end with one.
 * Numbers and booleans are embedded as-is; decimals keep their plain digits, never an exponent.
 * Embedded quotes are not escaped and the column type is not consulted, so a numeric-looking
 * string default stays quoted.
 */
public class DefaultValueFormatter {

    public String format(Object defaultValue) {
        if (defaultValue == null) return null;
        if (defaultValue instanceof String s) {
            return isQuoted(s) ? s : "'" + s + "'";
        }
        if (defaultValue instanceof BigDecimal d) {
            return d.toPlainString();
        }
        return String.valueOf(defaultValue);
    }

    private boolean isQuoted(String value) {
        return value.length() >= 2 && value.startsWith("'") && value.endsWith("'");
    }
}
