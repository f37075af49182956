package com.qubi.sitepoller.core.normalize;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extrae el primer número de un texto crudo: signo opcional, dígitos enteros
 * opcionales y parte fraccionaria opcional ("84 V" -> 84.0, "-.5A" -> -0.5).
 */
public final class NumericExtractor {
    private NumericExtractor(){}

    private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d*\\.\\d+|\\d+)");

    public static OptionalDouble extract(String raw) {
        if (raw == null) return OptionalDouble.empty();
        Matcher m = NUMBER.matcher(raw);
        if (!m.find()) return OptionalDouble.empty();
        double value;
        try {
            value = Double.parseDouble(m.group());
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
        // una tira de dígitos fuera de rango da Infinity: no es una lectura
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
