package com.teamsbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BotState {
    JOINING("joining"),
    IN_MEETING("in_meeting"),
    LEAVING("leaving"),
    LEFT("left"),
    ERROR("error");

    private final String wireValue;

    BotState(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == LEFT || this == ERROR;
    }
}
