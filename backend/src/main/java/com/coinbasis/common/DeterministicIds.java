package com.coinbasis.common;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Name-based (type 3) UUIDs. The same parts always yield the same id, so derived records can be upserted.
 */
public final class DeterministicIds {

    private static final String SEPARATOR = "|";

    private DeterministicIds() {
    }

    public static String of(String... parts) {
        if (parts == null || parts.length == 0) {
            throw new IllegalArgumentException("at least one id part is required");
        }
        String name = Stream.of(parts)
                .map(p -> Objects.requireNonNullElse(p, ""))
                .collect(Collectors.joining(SEPARATOR));
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
