package io.healthlog.processing.parser;

import java.util.regex.Pattern;

final class Numbers {

    // plain decimal notation only; Double.parseDouble would also take "45f" or "0x1p3"
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private Numbers() {
    }

    static double parseDecimal(String token) {
        if (!DECIMAL.matcher(token).matches()) {
            throw new NumberFormatException("Invalid number: '" + token + "'");
        }
        return Double.parseDouble(token);
    }

    static int parseInteger(String token) {
        return Integer.parseInt(token);
    }
}
