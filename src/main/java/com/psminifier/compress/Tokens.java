package com.psminifier.compress;

/**
 * Joins tokens without whitespace, except where two of them would otherwise merge into one.
 */
final class Tokens {

    private Tokens() {
    }

    static String join(String left, String right) {
        return needsSpace(left, right) ? left + " " + right : left + right;
    }

    static String join(String left, String operator, String right) {
        return join(join(left, operator), right);
    }

    /**
     * {@code [ System.Collections.Hashtable ]} and {@code System.Collections.Hashtable} both become
     * {@code System.Collections.Hashtable}.
     */
    static String typeName(String name) {
        String stripped = name.replaceAll("\\s+", "");
        if (stripped.startsWith("[") && stripped.endsWith("]")) {
            stripped = stripped.substring(1, stripped.length() - 1);
        }
        return stripped;
    }

    static String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= 60 ? flat : flat.substring(0, 57) + "...";
    }

    private static boolean needsSpace(String left, String right) {
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        char a = left.charAt(left.length() - 1);
        char b = right.charAt(0);
        if (isWordChar(a) && (isWordChar(b) || b == '-')) {
            // $x -eq 1, 1 -2, -not 1
            return true;
        }
        if (Character.isLetter(a) && b == '.') {
            return true;
        }
        // 1 - -1, $i++ +1
        return (a == '-' || a == '+') && a == b;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
