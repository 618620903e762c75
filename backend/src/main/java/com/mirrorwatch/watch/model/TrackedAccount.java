package com.mirrorwatch.watch.model;

import java.util.ArrayList;
import java.util.List;

public record TrackedAccount(
    String alias,
    String handle
) {
    public static TrackedAccount of(String alias, String handle) {
        String safeHandle = normalizeHandle(handle);
        if (safeHandle.isEmpty()) {
            throw new IllegalArgumentException("Tracked account handle must not be blank");
        }
        String safeAlias = alias == null || alias.isBlank() ? safeHandle : alias.trim();
        return new TrackedAccount(safeAlias, safeHandle);
    }

    public static List<TrackedAccount> parseList(String value) {
        List<TrackedAccount> out = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return out;
        }
        for (String entry : value.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.indexOf(':');
            if (separator < 0) {
                out.add(of(null, trimmed));
            } else if (!normalizeHandle(trimmed.substring(separator + 1)).isEmpty()) {
                out.add(of(trimmed.substring(0, separator), trimmed.substring(separator + 1)));
            }
        }
        return out;
    }

    private static String normalizeHandle(String handle) {
        if (handle == null) {
            return "";
        }
        String trimmed = handle.trim();
        while (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed;
    }
}
