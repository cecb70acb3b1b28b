package com.dpp.audit.crypto;

import com.dpp.audit.exception.MalformedEventFieldException;

/**
 * RFC 8785 (JSON Canonicalization Scheme) writer for {@link MetadataValue}.
 *
 * <p>Output rules, which must never change without migrating stored chains:
 * <ul>
 *   <li>object members sorted by key, compared as UTF-16 code units;</li>
 *   <li>no whitespace; {@code ,} between members and items, {@code :} after keys;</li>
 *   <li>strings escape {@code "} and {@code \} with a backslash, use the short forms
 *       {@code \b \f \n \r \t}, and {@code \}{@code u00xx} with lowercase hex for the
 *       remaining control characters below U+0020; every other character is
 *       emitted as-is and the result is encoded as UTF-8;</li>
 *   <li>integers in plain decimal, {@code true}, {@code false}, {@code null}.</li>
 * </ul>
 * General purpose JSON libraries differ from this in escaping and member order,
 * which is why hashing never goes through one.
 */
public final class CanonicalJson {

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private CanonicalJson() {
    }

    public static String write(MetadataValue value) {
        StringBuilder out = new StringBuilder();
        value.appendCanonical(out);
        return out.toString();
    }

    static void appendString(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    out.append("\\\"");
                    break;
                case '\\':
                    out.append("\\\\");
                    break;
                case '\b':
                    out.append("\\b");
                    break;
                case '\f':
                    out.append("\\f");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\r':
                    out.append("\\r");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        out.append("\\u00")
                                .append(HEX_DIGITS[(c >> 4) & 0xF])
                                .append(HEX_DIGITS[c & 0xF]);
                    } else {
                        out.append(c);
                    }
            }
        }
        out.append('"');
    }

    /**
     * Rejects strings containing unpaired UTF-16 surrogates, which have no
     * UTF-8 encoding.
     */
    static void requireWellFormed(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < value.length() && Character.isLowSurrogate(value.charAt(i + 1))) {
                    i++;
                    continue;
                }
                throw new MalformedEventFieldException("Unpaired surrogate at index " + i);
            }
            if (Character.isLowSurrogate(c)) {
                throw new MalformedEventFieldException("Unpaired surrogate at index " + i);
            }
        }
    }
}
