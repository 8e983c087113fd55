package com.acme.corna.permissions;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Permission {
    READ(0x1),
    WRITE(0x2),
    EDIT(0x4),
    DELETE(0x8),
    CHANGE_THEME(0x10),
    CHANGE_PERMISSIONS(0x20),
    COMMENT(0x40),
    LIKE(0x80),
    FOLLOW(0x100);

    private final long flag;

    Permission(long flag) {
        this.flag = flag;
    }

    public long flag() {
        return flag;
    }

    /** Lower-case name used on the wire, e.g. {@code change_theme}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Permission> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.name().equals(normalized)).findFirst();
    }

    public static Permission require(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown permission '" + key + "'"));
    }
}
