package com.procrawl.listingsync.ingest.normalize;

import com.procrawl.listingsync.ingest.model.NumericFormat;
import org.jsoup.Jsoup;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FieldParsers {
    private static final Pattern NUMBER_TOKEN = Pattern.compile("-?\\d[\\d.,]*");

    private FieldParsers() {
    }

    /**
     * Parses a scraped numeric value ("R$ 3.100,00", "72 m²", "2 quartos"). Returns {@code null}
     * when nothing numeric can be read; INTEGER yields a {@link Long}, the other formats a
     * {@link BigDecimal} without trailing zeros.
     */
    public static Number parseNumber(Object value, NumericFormat format) {
        if (value == null || format == null) {
            return null;
        }
        BigDecimal decimal;
        if (value instanceof Number number) {
            decimal = toBigDecimal(number);
        } else {
            decimal = parseText(value.toString(), format);
        }
        if (decimal == null) {
            return null;
        }
        if (format == NumericFormat.INTEGER) {
            try {
                return decimal.setScale(0, RoundingMode.DOWN).longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        return clean(decimal);
    }

    /**
     * Markup reduced to its visible text, whitespace collapsed. Blank results become {@code null}.
     */
    public static String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return null;
        }
        String text = Jsoup.parse(html).text().trim();
        return text.isEmpty() ? null : text;
    }

    private static BigDecimal parseText(String text, NumericFormat format) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = NUMBER_TOKEN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String token = stripTrailingSeparators(matcher.group());
        String normalized = format == NumericFormat.BRAZILIAN_CURRENCY
            ? token.replace(".", "").replace(',', '.')
            : normalizeSeparators(token);
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // The last separator is the decimal one when both appear; a lone separator seen once is
    // decimal unless exactly three digits follow it.
    private static String normalizeSeparators(String token) {
        int lastComma = token.lastIndexOf(',');
        int lastDot = token.lastIndexOf('.');
        if (lastComma != -1 && lastDot != -1) {
            char decimalSeparator = lastComma > lastDot ? ',' : '.';
            char groupSeparator = decimalSeparator == ',' ? '.' : ',';
            return token.replace(String.valueOf(groupSeparator), "").replace(decimalSeparator, '.');
        }
        char separator = lastComma != -1 ? ',' : '.';
        int last = Math.max(lastComma, lastDot);
        if (last == -1) {
            return token;
        }
        boolean single = token.indexOf(separator) == last;
        boolean grouping = !single || token.length() - last - 1 == 3;
        if (grouping) {
            return token.replace(String.valueOf(separator), "");
        }
        return token.replace(separator, '.');
    }

    private static String stripTrailingSeparators(String token) {
        String out = token;
        while (!out.isEmpty() && (out.endsWith(".") || out.endsWith(","))) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return null;
            }
            return BigDecimal.valueOf(value);
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal clean(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
