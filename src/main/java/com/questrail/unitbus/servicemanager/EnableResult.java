package com.questrail.unitbus.servicemanager;

import java.util.List;

/**
 * Result of {@link ServiceManager#enableUnitFiles}.
 *
 * @param carriesInstallInfo whether the unit files had an {@code [Install]} section
 * @param changes            symlinks created
 */
public record EnableResult(boolean carriesInstallInfo, List<UnitFileChange> changes)
{
    public EnableResult
    {
        changes = List.copyOf(changes);
    }
}
