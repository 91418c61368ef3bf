package com.treeroll.service.core.metric;

import java.math.BigDecimal;

/** Renders metric numbers as plain decimal strings without trailing zeros. */
public final class DecimalRenderer {

    private DecimalRenderer() {}

    public static String render(BigDecimal value) {
        if (value == null) {
            return null;
        }
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    public static BigDecimal parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return new BigDecimal(value);
    }
}
