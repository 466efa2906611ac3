package com.teamsbot.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Getter
@Builder
public class SessionSettings {

    // How long a finished session stays resolvable so final events can flush
    private final Duration removalGracePeriod;

    private final int inboxCapacity;

    private final String defaultLanguage;
}
