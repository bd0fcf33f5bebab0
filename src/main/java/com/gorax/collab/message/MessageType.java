package com.gorax.collab.message;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Envelope types. Client requests are listed first, server events after.
 */
public enum MessageType {
    JOIN("join"),
    LEAVE("leave"),
    PRESENCE("presence"),
    LOCK_ACQUIRE("lock_acquire"),
    LOCK_RELEASE("lock_release"),
    CHANGE("change"),

    USER_JOINED("user_joined"),
    USER_LEFT("user_left"),
    PRESENCE_UPDATE("presence_update"),
    LOCK_ACQUIRED("lock_acquired"),
    LOCK_RELEASED("lock_released"),
    LOCK_FAILED("lock_failed"),
    CHANGE_APPLIED("change_applied"),
    ERROR("error");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String value) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(value))
            .findFirst();
    }
}
