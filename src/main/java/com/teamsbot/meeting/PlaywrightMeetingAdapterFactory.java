package com.teamsbot.meeting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.teamsbot.config.MeetingSettings;
import com.teamsbot.config.TranscriptionSettings;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

@Slf4j
@Component
public class PlaywrightMeetingAdapterFactory implements MeetingAdapterFactory {

    private final MeetingSettings settings;
    private final int sampleRate;
    private final Executor meetingExecutor;
    private final ObjectMapper objectMapper;

    public PlaywrightMeetingAdapterFactory(MeetingSettings settings, TranscriptionSettings transcriptionSettings,
                                           @Qualifier("meetingExecutor") Executor meetingExecutor,
                                           ObjectMapper objectMapper) {
        this.settings = settings;
        this.sampleRate = transcriptionSettings.getSampleRate();
        this.meetingExecutor = meetingExecutor;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void verifyBrowser() {
        if (!settings.isVerifyBrowserOnStartup()) {
            return;
        }
        try (Playwright pw = Playwright.create()) {
            log.info("Playwright verified and available (version check on startup)");
        } catch (PlaywrightException e) {
            log.error("Playwright NOT available! Install browsers with: mvn exec:java -e -Dexec.mainClass=com.microsoft.playwright.CLI -Dexec.args=\"install chromium\"");
            throw new IllegalStateException("Playwright initialization failed", e);
        }
    }

    @Override
    public MeetingAdapter create(String botId) {
        return new PlaywrightTeamsMeetingAdapter(botId, settings, sampleRate, meetingExecutor, objectMapper);
    }
}
