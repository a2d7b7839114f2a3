package com.questrail.unitbus.servicemanager;

import com.questrail.unitbus.protocol.bus.body.BodyWriter;

import java.util.List;
import java.util.Objects;

/**
 * One property of a transient unit, written as a {@code (sv)} struct.
 *
 * @param name      property name, e.g. {@code Description}
 * @param signature type of the value inside the variant
 * @param value     writes the value
 */
public record UnitProperty(String name, String signature, BodyWriter.Content value)
{
    public UnitProperty
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(value, "value");
    }

    /**
     * {@code ExecStart}: runs {@code command[0]} with argv {@code command}.
     *
     * @param uncleanIsFailure whether an unclean exit marks the unit failed
     */
    public static UnitProperty execStart(List<String> command, boolean uncleanIsFailure)
    {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must name an executable");
        }
        final List<String> argv = List.copyOf(command);
        return new UnitProperty("ExecStart", "a(sasb)", w -> w.writeArray("(sasb)", List.of(argv),
                (aw, c) -> aw.writeStruct(sw -> sw
                        .writeString(c.get(0))
                        .writeStringArray(c)
                        .writeBoolean(uncleanIsFailure))));
    }

    public static UnitProperty description(String description)
    {
        Objects.requireNonNull(description, "description");
        return new UnitProperty("Description", "s", w -> w.writeString(description));
    }

    public static UnitProperty remainAfterExit(boolean remain)
    {
        return new UnitProperty("RemainAfterExit", "b", w -> w.writeBoolean(remain));
    }

    public static UnitProperty slice(String slice)
    {
        Objects.requireNonNull(slice, "slice");
        return new UnitProperty("Slice", "s", w -> w.writeString(slice));
    }

    void writeTo(BodyWriter w)
    {
        w.writeStruct(sw -> sw.writeString(name).writeVariant(signature, value));
    }
}
