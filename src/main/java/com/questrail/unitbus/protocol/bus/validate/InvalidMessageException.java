package com.questrail.unitbus.protocol.bus.validate;

import com.questrail.unitbus.protocol.bus.BusException;
import com.questrail.unitbus.protocol.bus.model.HeaderField;

import java.util.Objects;
import java.util.Optional;

/**
 * Raised when a message violates the framing rules or a structural invariant
 * of the protocol.
 *
 * <p>The {@link #violation()} identifies the cause. For
 * {@link Violation#MISSING_REQUIRED_HEADER} the missing field is also
 * available through {@link #field()}.</p>
 */
public final class InvalidMessageException extends BusException
{
    private final Violation violation;
    private final HeaderField field;

    public InvalidMessageException(Violation violation, String detail)
    {
        this(violation, null, detail, null);
    }

    public InvalidMessageException(Violation violation, String detail, Throwable cause)
    {
        this(violation, null, detail, cause);
    }

    public InvalidMessageException(Violation violation, HeaderField field, String detail)
    {
        this(violation, field, detail, null);
    }

    private InvalidMessageException(Violation violation, HeaderField field, String detail, Throwable cause)
    {
        super("invalid message: " + Objects.requireNonNull(violation, "violation") + " (" + detail + ")", cause);
        this.violation = violation;
        this.field = field;
    }

    public Violation violation()
    {
        return violation;
    }

    /**
     * The header field the violation concerns, when there is a single one.
     */
    public Optional<HeaderField> field()
    {
        return Optional.ofNullable(field);
    }
}
