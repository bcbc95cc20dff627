package com.healer.remediator.naming;

import java.util.List;

/**
 * A resource name together with the segments it was built from.
 *
 * {@code truncated} is set when the value no longer carries the full
 * variable segment; {@code hardTruncated} when even the fixed segments
 * had to be cut.
 */
public record Identifier(
        String       value,
        String       prefix,
        String       variable,
        List<String> suffixes,
        boolean      truncated,
        boolean      hardTruncated
) {
    public Identifier {
        suffixes = List.copyOf(suffixes);
    }

    public int length() {
        return value.length();
    }

    @Override
    public String toString() {
        return value;
    }
}
