package com.questrail.unitbus.servicemanager;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class UnitPathsTest
{
    @Test
    void dotsAndDashesAreEscaped()
    {
        assertEquals("/org/freedesktop/systemd1/unit/nginx_2eservice", UnitPaths.pathFor("nginx.service"));
        assertEquals("build_2d42_2eservice", UnitPaths.escape("build-42.service"));
    }

    @Test
    void onlyALeadingDigitIsEscaped()
    {
        assertEquals("_31abc2", UnitPaths.escape("1abc2"));
    }

    @Test
    void emptyNameBecomesUnderscore()
    {
        assertEquals("_", UnitPaths.escape(""));
    }

    @Test
    void nonAsciiIsEscapedPerUtf8Byte()
    {
        assertEquals("caf_c3_a9", UnitPaths.escape("café"));
    }
}
