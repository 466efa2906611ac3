package com.teamsbot.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Getter
@Builder
public class MeetingSettings {

    private final String defaultBotName;
    private final boolean headless;
    private final int slowMo;
    private final int viewportWidth;
    private final int viewportHeight;
    private final Duration joinTimeout;
    private final Duration leaveTimeout;
    private final Duration pollInterval;
    private final boolean verifyBrowserOnStartup;
}
