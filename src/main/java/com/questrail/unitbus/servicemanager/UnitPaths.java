package com.questrail.unitbus.servicemanager;

import java.nio.charset.StandardCharsets;

/**
 * Object paths of unit objects.
 *
 * <p>A unit's path is the unit prefix followed by its name with every byte
 * outside {@code [A-Za-z0-9]} (and a leading digit) replaced by {@code _}
 * and two lowercase hex digits, e.g. {@code nginx.service} becomes
 * {@code nginx_2eservice}.</p>
 */
public final class UnitPaths
{
    public static final String UNIT_PREFIX = "/org/freedesktop/systemd1/unit/";

    private UnitPaths() {}

    public static String pathFor(String unitName)
    {
        return UNIT_PREFIX + escape(unitName);
    }

    static String escape(String label)
    {
        if (label.isEmpty()) {
            return "_";
        }
        byte[] bytes = label.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length * 3);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            boolean letter = (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z');
            boolean digit = b >= '0' && b <= '9';
            if (letter || (digit && i > 0)) {
                sb.append((char) b);
            } else {
                sb.append('_').append(Character.forDigit(b >> 4, 16)).append(Character.forDigit(b & 0xF, 16));
            }
        }
        return sb.toString();
    }
}
