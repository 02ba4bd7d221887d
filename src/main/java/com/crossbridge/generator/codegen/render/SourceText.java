package com.crossbridge.generator.codegen.render;

import lombok.experimental.UtilityClass;

/**
 * Small text helpers for templating source code.
 */
@UtilityClass
public class SourceText {

    /** {@code ", " + s}, or nothing for an empty string. */
    public static String preComma(String s) {
        return s.isEmpty() ? s : ", " + s;
    }

    /** Parenthesized. */
    public static String p(String s) {
        return "(" + s + ")";
    }

    /** Double-quoted. */
    public static String q(String s) {
        return "\"" + s + "\"";
    }

    /** Angle-bracketed, as a template argument list. */
    public static String t(String s) {
        return "<" + s + ">";
    }
}
