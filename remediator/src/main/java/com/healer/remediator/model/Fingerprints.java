package com.healer.remediator.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable dedup keys for signals.
 */
public final class Fingerprints {

    private Fingerprints() {}

    /** sha-256 over "type\0target", first 16 hex chars. */
    public static String of(String type, String target) {
        String key = nullToEmpty(type) + '\0' + nullToEmpty(target);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    /**
     * Group related targets so operators can see storms from one source:
     * {@code play-task-12-abc} → {@code play-task-12},
     * {@code atlas-conflict-monitor-x} → {@code atlas-conflict-monitor},
     * {@code atlas-guardian-x} → {@code atlas-guardian};
     * anything else keeps its first two dash-separated parts.
     */
    public static String workflowFamily(String target) {
        if (target == null || target.isBlank()) {
            return "unknown";
        }
        String[] parts = target.split("-");
        if (target.startsWith("play-task-") && parts.length >= 3) {
            return String.join("-", parts[0], parts[1], parts[2]);
        }
        if (target.startsWith("atlas-") && parts.length >= 3
                && (parts[1].equals("conflict") || parts[1].equals("batch"))) {
            return String.join("-", parts[0], parts[1], parts[2]);
        }
        if (parts.length >= 2) {
            return parts[0] + "-" + parts[1];
        }
        return parts[0];
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
