package org.learningjava.mediadb.infrastructure.adapter.in.web.dto;

import java.util.Base64;

public final class Base64Payloads {

    private Base64Payloads() {
    }

    /**
     * Decodes a base64 field, accepting an optional {@code data:...;base64,} prefix.
     *
     * @throws IllegalArgumentException when the value is blank or not valid base64
     */
    public static byte[] decode(String field, String value) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(field + " is required");
        String v = value.trim();
        int comma = v.indexOf(',');
        if (v.startsWith("data:") && comma > 0) v = v.substring(comma + 1);
        try {
            return Base64.getDecoder().decode(v.replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(field + " is not valid base64", e);
        }
    }

    public static byte[] decodeOptional(String field, String value) {
        return value == null || value.isBlank() ? null : decode(field, value);
    }
}
