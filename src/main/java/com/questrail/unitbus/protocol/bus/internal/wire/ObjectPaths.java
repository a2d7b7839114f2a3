package com.questrail.unitbus.protocol.bus.internal.wire;

/**
 * Object path syntax: {@code /} or slash-separated non-empty elements of
 * {@code [A-Za-z0-9_]}, without a trailing slash.
 */
public final class ObjectPaths
{
    private ObjectPaths() {}

    public static boolean isValid(String path)
    {
        if (path == null || path.isEmpty() || path.charAt(0) != '/') {
            return false;
        }
        if (path.length() == 1) {
            return true;
        }
        if (path.charAt(path.length() - 1) == '/') {
            return false;
        }
        char prev = '/';
        for (int i = 1; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '/') {
                if (prev == '/') {
                    return false;
                }
            } else if (!isElementChar(c)) {
                return false;
            }
            prev = c;
        }
        return true;
    }

    private static boolean isElementChar(char c)
    {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }
}
