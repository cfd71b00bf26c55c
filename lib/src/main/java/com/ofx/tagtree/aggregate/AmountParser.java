package com.ofx.tagtree.aggregate;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.util.Locale;

/**
 * Locale-neutral parser for OFX amounts. OFX allows either '.' or ',' as the decimal separator and
 * an explicit leading sign; grouping separators are never valid.
 */
public final class AmountParser {

    private static final ThreadLocal<DecimalFormat> DOT_FORMAT =
            ThreadLocal.withInitial(() -> buildFormat('.'));
    private static final ThreadLocal<DecimalFormat> COMMA_FORMAT =
            ThreadLocal.withInitial(() -> buildFormat(','));

    private AmountParser() {}

    /**
     * Parses an OFX amount such as {@code -1234.56}, {@code +0,50} or {@code .25}.
     *
     * @throws NumberFormatException for blank input, mixed or repeated separators, or trailing junk
     */
    public static BigDecimal parse(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            throw new NumberFormatException("Empty amount");
        }
        boolean negative = false;
        String digits = trimmed;
        char sign = trimmed.charAt(0);
        if (sign == '+' || sign == '-') {
            negative = sign == '-';
            digits = trimmed.substring(1);
        }
        if (digits.isEmpty() || digits.charAt(0) == '+' || digits.charAt(0) == '-') {
            throw new NumberFormatException("Invalid amount: " + text);
        }
        int dots = count(digits, '.');
        int commas = count(digits, ',');
        if (dots + commas > 1) {
            throw new NumberFormatException("Invalid decimal separators in amount: " + text);
        }
        DecimalFormat format = commas > 0 ? COMMA_FORMAT.get() : DOT_FORMAT.get();
        ParsePosition position = new ParsePosition(0);
        Number parsed = format.parse(digits, position);
        if (parsed == null || position.getIndex() != digits.length()) {
            throw new NumberFormatException("Invalid amount: " + text);
        }
        BigDecimal value = parsed instanceof BigDecimal ? (BigDecimal) parsed : new BigDecimal(parsed.toString());
        return negative ? value.negate() : value;
    }

    private static int count(String text, char c) {
        int total = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                total++;
            }
        }
        return total;
    }

    private static DecimalFormat buildFormat(char decimalSeparator) {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
        symbols.setDecimalSeparator(decimalSeparator);
        symbols.setGroupingSeparator(decimalSeparator == ',' ? '.' : ',');
        DecimalFormat format = new DecimalFormat();
        format.setDecimalFormatSymbols(symbols);
        format.setParseBigDecimal(true);
        format.setGroupingUsed(false);
        format.setMaximumFractionDigits(Integer.MAX_VALUE);
        format.setMaximumIntegerDigits(Integer.MAX_VALUE);
        return format;
    }
}
