package com.templet.name;

import com.templet.error.InvalidTagException;

/**
 * Character grammar for tag names.
 * <p>
 * A plain name is one or more of {@code [A-Za-z0-9_-]}. A name expression additionally allows
 * {@code .} separators and {@code [N]} index suffixes, but never two dots in a row.
 */
public final class TagNames {
    private TagNames() {
    }

    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!isNameChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isValidNameExpression(String name) {
        if (name == null || name.isEmpty() || name.contains("..")) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isNameChar(c) && c != '.' && c != '[' && c != ']') {
                return false;
            }
        }
        return true;
    }

    public static String requireName(String name, String message) {
        if (!isValidName(name)) {
            throw new InvalidTagException(message + ": '" + name + "'");
        }
        return name;
    }

    public static String requireNameExpression(String name, String message) {
        if (!isValidNameExpression(name)) {
            throw new InvalidTagException(message + ": '" + name + "'");
        }
        return name;
    }

    /**
     * Checks the character grammar, then tokenizes the path so malformed segments and
     * indexes fail here rather than on the first render.
     */
    public static String requirePath(String path, String message) {
        requireNameExpression(path, message);
        new PathParser().tokenize(path);
        return path;
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }
}
