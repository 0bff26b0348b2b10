package com.sentinel.common;

public final class Text {
    private Text() {
    }

    /** Cuts {@code s} to at most {@code n} characters; the last one is an ellipsis when anything was cut. */
    public static String trim(String s, int n) {
        if (s == null) return "";
        return s.length() > n ? s.substring(0, n - 1) + "…" : s;
    }
}
