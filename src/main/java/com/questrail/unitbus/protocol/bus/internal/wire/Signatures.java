package com.questrail.unitbus.protocol.bus.internal.wire;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for type signatures: alignment of each type code and splitting a
 * signature into complete types.
 */
public final class Signatures
{
    /** Deepest container nesting accepted in a signature. */
    static final int MAX_DEPTH = 64;

    private Signatures() {}

    /**
     * Returns the wire alignment of the type starting with {@code code}.
     *
     * @throws MalformedWireDataException for an unknown type code
     */
    public static int alignmentOf(char code) throws MalformedWireDataException
    {
        return switch (code) {
            case 'y', 'g', 'v' -> 1;
            case 'n', 'q' -> 2;
            case 'b', 'i', 'u', 's', 'o', 'a', 'h' -> 4;
            case 'x', 't', 'd', '(', '{' -> 8;
            default -> throw new MalformedWireDataException("unknown type code '" + code + "'");
        };
    }

    /**
     * Returns the index just past the complete type starting at {@code start}.
     *
     * @throws MalformedWireDataException if no complete type starts there
     */
    public static int endOfCompleteType(String signature, int start) throws MalformedWireDataException
    {
        return endOf(signature, start, 0);
    }

    /**
     * Splits a signature into its complete types, e.g. {@code "sa{sv}b"} into
     * {@code ["s", "a{sv}", "b"]}.
     */
    public static List<String> split(String signature) throws MalformedWireDataException
    {
        List<String> types = new ArrayList<>();
        int i = 0;
        while (i < signature.length()) {
            int end = endOfCompleteType(signature, i);
            types.add(signature.substring(i, end));
            i = end;
        }
        return types;
    }

    private static int endOf(String sig, int i, int depth) throws MalformedWireDataException
    {
        if (depth > MAX_DEPTH) {
            throw new MalformedWireDataException("signature nested too deeply: " + sig);
        }
        if (i >= sig.length()) {
            throw new MalformedWireDataException("incomplete signature: " + sig);
        }
        final char c = sig.charAt(i);
        switch (c) {
            case 'a':
                return endOf(sig, i + 1, depth + 1);
            case '(': {
                int j = i + 1;
                if (j < sig.length() && sig.charAt(j) == ')') {
                    throw new MalformedWireDataException("empty struct in signature: " + sig);
                }
                while (j < sig.length() && sig.charAt(j) != ')') {
                    j = endOf(sig, j, depth + 1);
                }
                if (j >= sig.length()) {
                    throw new MalformedWireDataException("unterminated struct in signature: " + sig);
                }
                return j + 1;
            }
            case '{': {
                if (i == 0 || sig.charAt(i - 1) != 'a') {
                    throw new MalformedWireDataException("dict entry outside array in signature: " + sig);
                }
                int keyEnd = endOf(sig, i + 1, depth + 1);
                if (keyEnd != i + 2 || !isBasic(sig.charAt(i + 1))) {
                    throw new MalformedWireDataException("dict key must be a basic type: " + sig);
                }
                int valueEnd = endOf(sig, keyEnd, depth + 1);
                if (valueEnd >= sig.length() || sig.charAt(valueEnd) != '}') {
                    throw new MalformedWireDataException("unterminated dict entry in signature: " + sig);
                }
                return valueEnd + 1;
            }
            default:
                // ')' and '}' are not type codes, so a stray closer fails here
                alignmentOf(c);
                return i + 1;
        }
    }

    static boolean isBasic(char c)
    {
        return "ybnqiuxtdsogh".indexOf(c) >= 0;
    }
}
