package com.acme.corna.posts;

import java.util.Arrays;
import java.util.Optional;

public enum PostType {
    TEXT("text"),
    PICTURE("picture");

    private final String value;

    PostType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<PostType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}
