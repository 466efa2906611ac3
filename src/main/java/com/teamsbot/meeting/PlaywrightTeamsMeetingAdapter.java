package com.teamsbot.meeting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import com.teamsbot.config.MeetingSettings;
import com.teamsbot.exception.JoinFailureException;
import com.teamsbot.model.AudioChunk;
import lombok.extern.slf4j.Slf4j;

import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Joins a Teams meeting anonymously through the Teams web client in headless Chromium.
 *
 * <p>All Playwright calls happen on one thread taken from the meeting executor: Playwright Java
 * is not thread-safe, so the instance is created, used and closed there.
 */
@Slf4j
public class PlaywrightTeamsMeetingAdapter implements MeetingAdapter {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";

    private static final List<String> CHROMIUM_ARGS = List.of(
            "--use-fake-ui-for-media-stream",
            "--use-fake-device-for-media-stream",
            "--autoplay-policy=no-user-gesture-required",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--no-first-run",
            "--no-default-browser-check",
            "--disable-gpu",
            "--disable-dev-shm-usage",
            "--no-sandbox");

    private static final String[] IN_MEETING_SELECTORS = {
            "[data-tid='hangup-main-btn']",
            "[data-tid='hangup-button']",
            "button[aria-label*='Leave' i]"
    };

    private static final String[] DENIED_SELECTORS = {
            "text=/denied access to the meeting/i",
            "text=/no one responded to your request/i",
            "text=/you can't join this meeting/i"
    };

    private static final String[] REMOVED_SELECTORS = {
            "text=/removed you from the meeting/i",
            "text=/you've been removed/i",
            "text=/you have been removed/i"
    };

    private static final String[] ENDED_SELECTORS = {
            "text=/meeting has ended/i",
            "text=/the meeting ended/i",
            "text=/call ended/i"
    };

    private enum Outcome { LEFT, ENDED, REMOVED, CLOSED }

    private final String botId;
    private final MeetingSettings settings;
    private final int sampleRate;
    private final Executor executor;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean leaveRequested = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile MeetingEventSink sink;

    public PlaywrightTeamsMeetingAdapter(String botId, MeetingSettings settings, int sampleRate,
                                         Executor executor, ObjectMapper objectMapper) {
        this.botId = botId;
        this.settings = settings;
        this.sampleRate = sampleRate;
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    @Override
    public void join(String meetingUrl, String displayName, MeetingEventSink sink) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Meeting adapter already started for bot " + botId);
        }
        this.sink = sink;
        try {
            executor.execute(() -> run(meetingUrl, displayName));
        } catch (RejectedExecutionException e) {
            log.error("[{}] No browser thread available", botId);
            sink.joinFailed("No browser capacity available");
        }
    }

    @Override
    public void leave() {
        if (leaveRequested.compareAndSet(false, true)) {
            log.info("[{}] Leave requested", botId);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("[{}] Closing meeting adapter", botId);
        }
    }

    private void run(String meetingUrl, String displayName) {
        Playwright playwright = null;
        BrowserContext context = null;
        Page page = null;
        boolean joined = false;

        try {
            log.info("[{}] Creating Playwright instance on thread: {}", botId, Thread.currentThread().getName());
            playwright = Playwright.create();

            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(settings.isHeadless())
                    .setSlowMo(settings.getSlowMo())
                    .setArgs(CHROMIUM_ARGS));

            context = browser.newContext(new Browser.NewContextOptions()
                    .setPermissions(List.of("microphone", "camera"))
                    .setViewportSize(settings.getViewportWidth(), settings.getViewportHeight())
                    .setUserAgent(USER_AGENT)
                    .setLocale("en-US"));

            page = context.newPage();
            page.addInitScript(TeamsPageScripts.STEALTH);
            page.addInitScript(TeamsPageScripts.audioCapture(sampleRate));

            log.info("[{}] Navigating to meeting", botId);
            page.navigate(meetingUrl, new Page.NavigateOptions().setTimeout(60000));
            try {
                page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(20000));
            } catch (PlaywrightException e) {
                log.debug("[{}] NETWORKIDLE not reached, continuing anyway", botId);
            }

            continueInBrowser(page);
            handlePreJoinScreen(page, displayName);
            clickJoin(page);

            if (!waitForAdmission(page)) {
                // leave requested while still in the lobby
                emit(MeetingEventSink::left);
                return;
            }
            joined = true;
            log.info("[{}] Admitted to meeting", botId);
            emit(MeetingEventSink::joined);

            Outcome outcome = capture(page);
            switch (outcome) {
                case ENDED -> emit(MeetingEventSink::ended);
                case REMOVED -> emit(MeetingEventSink::removed);
                case LEFT -> {
                    leaveMeeting(page);
                    emit(MeetingEventSink::left);
                }
                case CLOSED -> log.debug("[{}] Adapter closed, stopping capture", botId);
            }
        } catch (JoinFailureException e) {
            log.warn("[{}] Join failed: {}", botId, e.getMessage());
            emit(s -> s.joinFailed(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Meeting thread interrupted", botId);
            emit(s -> s.error("Meeting thread interrupted"));
        } catch (RuntimeException e) {
            log.error("[{}] Error during meeting: {}", botId, e.getMessage(), e);
            String reason = "Browser error: " + e.getMessage();
            if (joined) {
                emit(s -> s.error(reason));
            } else {
                emit(s -> s.joinFailed(reason));
            }
        } finally {
            if (context != null) {
                try {
                    context.close();
                } catch (PlaywrightException e) {
                    log.warn("[{}] Error closing context: {}", botId, e.getMessage());
                }
            }
            if (playwright != null) {
                try {
                    playwright.close();
                    log.info("[{}] Playwright instance closed", botId);
                } catch (PlaywrightException e) {
                    log.warn("[{}] Error closing Playwright: {}", botId, e.getMessage());
                }
            }
        }
    }

    private void continueInBrowser(Page page) {
        Locator continueButton = page.locator("button:has-text('Continue on this browser')");
        try {
            continueButton.first().click(new Locator.ClickOptions().setTimeout(10000));
            log.info("[{}] Chose to continue in the browser", botId);
        } catch (PlaywrightException e) {
            log.debug("[{}] 'Continue on this browser' not offered", botId);
        }
    }

    private void handlePreJoinScreen(Page page, String displayName) throws InterruptedException {
        log.info("[{}] Handling pre-join screen", botId);
        Locator nameInput = page.locator("#username, input[data-tid='prejoin-display-name-input'], input[placeholder*='name' i]");
        try {
            nameInput.first().waitFor(new Locator.WaitForOptions().setTimeout(15000));
            nameInput.first().fill(displayName);
            log.info("[{}] Display name set to '{}'", botId, displayName);
        } catch (PlaywrightException e) {
            log.debug("[{}] Name input not found", botId);
        }

        toggleOff(page, "[data-tid='toggle-video']", "camera");
        toggleOff(page, "[data-tid='toggle-mute']", "microphone");
        Thread.sleep(500);
    }

    private void toggleOff(Page page, String selector, String device) {
        try {
            Locator toggle = page.locator(selector).first();
            if (toggle.count() > 0 && "true".equals(toggle.getAttribute("aria-checked"))) {
                toggle.click();
                log.info("[{}] Turned off {}", botId, device);
            }
        } catch (PlaywrightException e) {
            log.debug("[{}] Could not toggle {}: {}", botId, device, e.getMessage());
        }
    }

    private void clickJoin(Page page) {
        Locator joinButton = page.locator("[data-tid='prejoin-join-button'], button:has-text('Join now')").first();
        try {
            joinButton.click(new Locator.ClickOptions().setTimeout(15000));
            log.info("[{}] Clicked join button", botId);
        } catch (PlaywrightException e) {
            throw new JoinFailureException("Could not find the Teams join button", e);
        }
    }

    /**
     * @return false if a leave was requested before admission
     * @throws JoinFailureException if admission was denied or timed out
     */
    private boolean waitForAdmission(Page page) throws InterruptedException {
        long deadline = System.nanoTime() + settings.getJoinTimeout().toNanos();
        boolean loggedLobby = false;
        while (System.nanoTime() < deadline) {
            if (leaveRequested.get() || closed.get()) {
                log.info("[{}] Leaving before admission", botId);
                return false;
            }
            if (anyVisible(page, DENIED_SELECTORS)) {
                throw new JoinFailureException("Admission to the meeting was denied");
            }
            if (anyVisible(page, IN_MEETING_SELECTORS)) {
                return true;
            }
            if (!loggedLobby) {
                log.info("[{}] Waiting in the lobby for admission", botId);
                loggedLobby = true;
            }
            Thread.sleep(1000);
        }
        throw new JoinFailureException("Not admitted within " + settings.getJoinTimeout().toSeconds() + " s");
    }

    private Outcome capture(Page page) throws InterruptedException {
        Map<String, String> roster = new HashMap<>();
        long polls = 0;
        while (true) {
            if (closed.get()) {
                return Outcome.CLOSED;
            }
            if (leaveRequested.get()) {
                return Outcome.LEFT;
            }
            drain(page, roster);
            // selector checks are slower than the audio drain, check them once a second
            if (polls++ % Math.max(1, 1000 / Math.max(1, settings.getPollInterval().toMillis())) == 0) {
                if (anyVisible(page, REMOVED_SELECTORS)) {
                    log.info("[{}] Removed from meeting", botId);
                    return Outcome.REMOVED;
                }
                if (anyVisible(page, ENDED_SELECTORS) || !anyVisible(page, IN_MEETING_SELECTORS)) {
                    log.info("[{}] Meeting has ended", botId);
                    return Outcome.ENDED;
                }
            }
            Thread.sleep(settings.getPollInterval().toMillis());
        }
    }

    private void drain(Page page, Map<String, String> roster) {
        PageSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue((String) page.evaluate(TeamsPageScripts.DRAIN), PageSnapshot.class);
        } catch (JsonProcessingException e) {
            log.warn("[{}] Unreadable page snapshot: {}", botId, e.getOriginalMessage());
            return;
        }

        for (String encoded : snapshot.getAudio()) {
            AudioChunk chunk = AudioChunk.builder()
                    .pcm(Base64.getDecoder().decode(encoded))
                    .speakerId(snapshot.getSpeakerId())
                    .speakerName(snapshot.getSpeakerName())
                    .build();
            emit(s -> s.audio(chunk));
        }

        Map<String, String> current = new HashMap<>();
        for (PageSnapshot.Participant participant : snapshot.getParticipants()) {
            current.put(participant.getId(), participant.getName());
            if (!roster.containsKey(participant.getId())) {
                emit(s -> s.participantJoined(participant.getId(), participant.getName()));
            }
        }
        roster.forEach((id, name) -> {
            if (!current.containsKey(id)) {
                emit(s -> s.participantLeft(id, name));
            }
        });
        roster.clear();
        roster.putAll(current);
    }

    private void leaveMeeting(Page page) {
        log.info("[{}] Leaving meeting", botId);
        try {
            Object result = page.evaluate(TeamsPageScripts.CLICK_LEAVE);
            log.info("[{}] Leave button JS result: {}", botId, result);
            page.waitForTimeout(1000);
        } catch (PlaywrightException e) {
            log.warn("[{}] Error leaving: {}", botId, e.getMessage());
        }
    }

    private boolean anyVisible(Page page, String[] selectors) {
        for (String selector : selectors) {
            try {
                if (page.locator(selector).count() > 0) {
                    return true;
                }
            } catch (PlaywrightException e) {
                log.debug("[{}] Selector check failed for {}: {}", botId, selector, e.getMessage());
            }
        }
        return false;
    }

    private void emit(Consumer<MeetingEventSink> signal) {
        MeetingEventSink target = sink;
        if (target != null && !closed.get()) {
            signal.accept(target);
        }
    }
}
