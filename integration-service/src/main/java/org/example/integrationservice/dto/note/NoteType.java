package org.example.integrationservice.dto.note;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum NoteType {
    LINK_CREATED("link_created"),
    BOOKED("booked"),
    CANCELLED("cancelled"),
    RESCHEDULED("rescheduled");

    private final String value;

    public static Optional<NoteType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst();
    }
}
