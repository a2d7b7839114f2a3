package com.questrail.unitbus.servicemanager;

import java.util.List;

/**
 * One entry of {@code ListUnits}.
 */
public record UnitStatus(
        String name,
        String description,
        String loadState,
        String activeState,
        String subState,
        String followed,
        String path,
        long jobId,
        String jobType,
        String jobPath)
{
    /**
     * Maps one {@code (ssssssouso)} struct as read by the body reader.
     */
    static UnitStatus fromStruct(List<?> s)
    {
        return new UnitStatus(
                (String) s.get(0),
                (String) s.get(1),
                (String) s.get(2),
                (String) s.get(3),
                (String) s.get(4),
                (String) s.get(5),
                (String) s.get(6),
                (Long) s.get(7),
                (String) s.get(8),
                (String) s.get(9));
    }
}
