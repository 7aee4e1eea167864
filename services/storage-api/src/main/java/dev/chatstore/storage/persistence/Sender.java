package dev.chatstore.storage.persistence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Sender {
    USER,
    AI;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Sender fromWire(String value) {
        if (value == null) return null;
        return Sender.valueOf(value.trim().toUpperCase());
    }
}
