package com.questrail.unitbus.protocol.bus.validate;

/**
 * Discriminates every way a message can be rejected by the codec or validator.
 *
 * <p>Each failure maps to exactly one constant so that callers can branch on
 * the cause without parsing messages.</p>
 */
public enum Violation
{
    // Framing: the byte stream is not a message of this protocol.
    INVALID_BYTE_ORDER(Category.FRAMING),
    UNSUPPORTED_PROTOCOL_VERSION(Category.FRAMING),
    MALFORMED_HEADER(Category.FRAMING),
    MESSAGE_TOO_LARGE(Category.FRAMING),

    // Validity: the message is well framed but breaks a protocol invariant.
    INVALID_FLAGS(Category.VALIDITY),
    INVALID_MESSAGE_TYPE(Category.VALIDITY),
    INVALID_HEADER_FIELD(Category.VALIDITY),
    HEADER_TYPE_MISMATCH(Category.VALIDITY),
    MISSING_REQUIRED_HEADER(Category.VALIDITY),
    MISSING_SIGNATURE(Category.VALIDITY),

    // Body: the body does not match its declared signature.
    MALFORMED_BODY(Category.VALIDITY);

    public enum Category
    {
        FRAMING,
        VALIDITY
    }

    private final Category category;

    Violation(Category category)
    {
        this.category = category;
    }

    public Category category()
    {
        return category;
    }
}
