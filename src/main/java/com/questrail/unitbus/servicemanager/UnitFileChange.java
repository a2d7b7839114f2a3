package com.questrail.unitbus.servicemanager;

import java.util.List;

/**
 * A change made while enabling or disabling unit files.
 *
 * @param type        {@code symlink} or {@code unlink}
 * @param filename    file that was created or removed
 * @param destination symlink target, empty for {@code unlink}
 */
public record UnitFileChange(String type, String filename, String destination)
{
    static UnitFileChange fromStruct(List<?> s)
    {
        return new UnitFileChange((String) s.get(0), (String) s.get(1), (String) s.get(2));
    }
}
