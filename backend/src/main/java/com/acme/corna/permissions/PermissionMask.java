package com.acme.corna.permissions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bit arithmetic over {@link Permission} flags.
 */
public final class PermissionMask {
    private static final Logger log = LoggerFactory.getLogger(PermissionMask.class);

    private PermissionMask() {}

    /**
     * ORs together the flags of the given names. Names are matched case-insensitively
     * and unknown ones are skipped.
     */
    public static long of(Collection<String> names) {
        long mask = 0;
        if (names == null) return mask;
        for (String name : names) {
            Optional<Permission> permission = Permission.fromKey(name);
            if (permission.isEmpty()) {
                log.warn("Skipping unknown permission '{}'", name);
                continue;
            }
            mask |= permission.get().flag();
        }
        return mask;
    }

    public static Map<String, Boolean> toMap(long mask) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (Permission permission : Permission.values()) {
            result.put(permission.key(), has(mask, permission));
        }
        return result;
    }

    public static boolean has(long mask, Permission permission) {
        return (mask & permission.flag()) != 0;
    }

    public static long add(long mask, Permission permission) {
        return mask | permission.flag();
    }

    public static long remove(long mask, Permission permission) {
        return mask & ~permission.flag();
    }
}
