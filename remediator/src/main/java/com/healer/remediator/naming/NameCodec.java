package com.healer.remediator.naming;

import com.healer.remediator.config.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Deterministic, length-bounded name builder.
 *
 * A name is {@code prefix-variable-suffix1-suffix2...}. Empty segments are
 * skipped. When the name is too long only the variable segment is shortened;
 * the prefix and suffixes survive verbatim unless even an empty variable
 * segment cannot make the name fit.
 */
public class NameCodec {

    public static final char SEPARATOR       = '-';
    public static final int  DEFAULT_MAX_LEN = 63;   // Kubernetes object name limit

    private final int maxLength;

    public NameCodec() {
        this(DEFAULT_MAX_LEN);
    }

    public NameCodec(int maxLength) {
        if (maxLength <= 0) {
            throw new InvalidConfigurationException(
                    "Name length limit must be positive, got " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public int maxLength() { return maxLength; }

    // ------------------------------------------------------------------
    // Build
    // ------------------------------------------------------------------

    public Identifier build(String prefix, String variable, String... suffixes) {
        List<String> suffixList = Arrays.stream(suffixes)
                .map(s -> s == null ? "" : s)
                .toList();
        String p = prefix   == null ? "" : prefix;
        String v = variable == null ? "" : variable;
        return new Identifier(join(p, v, suffixList), p, v, suffixList, false, false);
    }

    /** Build and truncate to this codec's limit in one call. */
    public Identifier buildBounded(String prefix, String variable, String... suffixes) {
        return truncate(build(prefix, variable, suffixes), maxLength);
    }

    // ------------------------------------------------------------------
    // Truncate
    // ------------------------------------------------------------------

    public Identifier truncate(Identifier id) {
        return truncate(id, maxLength);
    }

    /**
     * Shorten {@code id} so that its value is at most {@code maxLen} characters.
     *
     * 1. Cut the variable segment to whatever room the fixed segments leave,
     *    stripping separators left dangling at the cut.
     * 2. If the variable segment vanishes entirely it is dropped together with
     *    its separator.
     * 3. If the fixed segments alone are still too long, the whole string is
     *    cut at maxLen and trailing separators are stripped.
     */
    public Identifier truncate(Identifier id, int maxLen) {
        if (maxLen <= 0) {
            throw new InvalidConfigurationException(
                    "Name length limit must be positive, got " + maxLen);
        }
        if (id.length() <= maxLen) {
            return id;
        }

        String withoutVariable = join(id.prefix(), "", id.suffixes());
        // Room left for the variable plus the separator it brings along, if any.
        int room = maxLen - withoutVariable.length() - (withoutVariable.isEmpty() ? 0 : 1);
        if (room > 0 && !id.variable().isEmpty()) {
            String shortened = stripTrailingSeparators(
                    id.variable().substring(0, Math.min(room, id.variable().length())));
            if (!shortened.isEmpty()) {
                String value = join(id.prefix(), shortened, id.suffixes());
                if (value.length() <= maxLen) {
                    return new Identifier(value, id.prefix(), shortened, id.suffixes(), true, false);
                }
            }
        }
        if (withoutVariable.length() <= maxLen) {
            String value = stripTrailingSeparators(withoutVariable);
            return new Identifier(value, id.prefix(), "", id.suffixes(), true, false);
        }

        String hard = stripTrailingSeparators(id.value().substring(0, maxLen));
        return new Identifier(hard, id.prefix(), "", id.suffixes(), true, true);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static String join(String prefix, String variable, List<String> suffixes) {
        List<String> parts = new ArrayList<>();
        if (!prefix.isEmpty())   parts.add(prefix);
        if (!variable.isEmpty()) parts.add(variable);
        for (String s : suffixes) {
            if (!s.isEmpty()) parts.add(s);
        }
        return String.join(String.valueOf(SEPARATOR), parts);
    }

    static String stripTrailingSeparators(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == SEPARATOR) {
            end--;
        }
        return s.substring(0, end);
    }
}
