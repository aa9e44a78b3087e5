package org.example.integrationservice.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum SyncEntityType {
    SCHEDULING_REQUEST("scheduling_request"),
    BOOKING("booking");

    private final String value;

    public static SyncEntityType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sync entity type: " + value));
    }
}
