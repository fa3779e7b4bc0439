/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses compact duration strings such as {@code 250ms}, {@code 1m30s} or {@code 1.5h}.
 * A bare number is read as milliseconds. ISO-8601 ({@code PT5S}) is accepted as well.
 */
public final class Durations {

    private Durations() {}

    public static Duration parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("duration is null");
        final String s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) throw new IllegalArgumentException("duration is blank");

        if (s.startsWith("pt") || s.startsWith("-pt")) {
            return Duration.parse(s.toUpperCase(Locale.ROOT));
        }

        if (isPlainNumber(s)) {
            return Duration.ofMillis(Long.parseLong(s));
        }

        int pos = 0;
        boolean negative = false;
        if (s.charAt(0) == '-' || s.charAt(0) == '+') {
            negative = s.charAt(0) == '-';
            pos++;
        }
        if (pos >= s.length()) throw new IllegalArgumentException("invalid duration \"" + raw + "\"");

        double totalNanos = 0;
        while (pos < s.length()) {
            int numStart = pos;
            while (pos < s.length() && (Character.isDigit(s.charAt(pos)) || s.charAt(pos) == '.')) pos++;
            if (numStart == pos) throw new IllegalArgumentException("invalid duration \"" + raw + "\"");
            final double value;
            try {
                value = Double.parseDouble(s.substring(numStart, pos));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid duration \"" + raw + "\"", e);
            }

            int unitStart = pos;
            while (pos < s.length() && Character.isLetter(s.charAt(pos))) pos++;
            if (unitStart == pos) throw new IllegalArgumentException("missing unit in duration \"" + raw + "\"");
            totalNanos += value * unitNanos(s.substring(unitStart, pos), raw);
        }

        if (totalNanos > Long.MAX_VALUE) throw new IllegalArgumentException("duration out of range \"" + raw + "\"");
        long nanos = Math.round(totalNanos);
        return Duration.ofNanos(negative ? -nanos : nanos);
    }

    private static boolean isPlainNumber(String s) {
        int start = (s.charAt(0) == '-' || s.charAt(0) == '+') ? 1 : 0;
        if (start >= s.length()) return false;
        for (int i = start; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    private static double unitNanos(String unit, String raw) {
        switch (unit) {
            case "ns":
                return 1d;
            case "us":
            case "µs":
                return 1_000d;
            case "ms":
                return 1_000_000d;
            case "s":
                return 1_000_000_000d;
            case "m":
                return 60d * 1_000_000_000d;
            case "h":
                return 3_600d * 1_000_000_000d;
            default:
                throw new IllegalArgumentException("unknown unit \"" + unit + "\" in duration \"" + raw + "\"");
        }
    }
}
