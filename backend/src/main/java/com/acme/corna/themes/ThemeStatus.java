package com.acme.corna.themes;

import java.util.Arrays;
import java.util.Optional;

/** Review state of the pull request that contributed a theme. */
public enum ThemeStatus {
    UNKNOWN("unknown"),
    MERGED("merged");

    private final String value;

    ThemeStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ThemeStatus> fromValue(String value) {
        return Arrays.stream(values()).filter(s -> s.value.equals(value)).findFirst();
    }
}
