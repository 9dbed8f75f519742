package com.deepansh.trader.core;

/** Lenient readers for loosely-typed agent parameters. */
final class Params {

    private Params() {}

    /** A positive whole number given as a number or a digit string; null otherwise, including on overflow. */
    static Long positiveLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue() > 0 ? n.longValue() : null;
        }
        if (value instanceof String s && s.trim().matches("\\d+")) {
            try {
                long parsed = Long.parseLong(s.trim());
                return parsed > 0 ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
