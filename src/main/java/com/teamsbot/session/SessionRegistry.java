package com.teamsbot.session;

import com.teamsbot.config.MeetingSettings;
import com.teamsbot.config.SessionSettings;
import com.teamsbot.exception.BotNotFoundException;
import com.teamsbot.exception.InvalidRequestException;
import com.teamsbot.exception.ServiceNotConfiguredException;
import com.teamsbot.meeting.MeetingAdapter;
import com.teamsbot.meeting.MeetingAdapterFactory;
import com.teamsbot.model.BotSnapshot;
import com.teamsbot.model.BotState;
import com.teamsbot.transcription.TranscriptionStreamFactory;
import com.teamsbot.webhook.WebhookDeliveryService;
import com.teamsbot.webhook.WebhookDispatcher;
import com.teamsbot.webhook.WebhookUrlPolicy;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns every live bot session, keyed by bot id. Sessions stay resolvable for a grace period after
 * they finish so the final status can still be polled.
 */
@Slf4j
@Service
public class SessionRegistry {

    private final Map<String, BotSession> sessions = new ConcurrentHashMap<>();

    private final MeetingAdapterFactory meetingAdapterFactory;
    private final TranscriptionStreamFactory transcriptionFactory;
    private final WebhookDeliveryService webhookDeliveryService;
    private final WebhookUrlPolicy webhookUrlPolicy;
    private final MeetingSettings meetingSettings;
    private final SessionSettings sessionSettings;
    private final TaskScheduler scheduler;
    private final Executor sessionExecutor;
    private final Clock clock;

    public SessionRegistry(MeetingAdapterFactory meetingAdapterFactory,
                           TranscriptionStreamFactory transcriptionFactory,
                           WebhookDeliveryService webhookDeliveryService,
                           WebhookUrlPolicy webhookUrlPolicy,
                           MeetingSettings meetingSettings,
                           SessionSettings sessionSettings,
                           TaskScheduler scheduler,
                           @Qualifier("botSessionExecutor") Executor sessionExecutor,
                           Clock clock) {
        this.meetingAdapterFactory = meetingAdapterFactory;
        this.transcriptionFactory = transcriptionFactory;
        this.webhookDeliveryService = webhookDeliveryService;
        this.webhookUrlPolicy = webhookUrlPolicy;
        this.meetingSettings = meetingSettings;
        this.sessionSettings = sessionSettings;
        this.scheduler = scheduler;
        this.sessionExecutor = sessionExecutor;
        this.clock = clock;
    }

    /**
     * Validates the request, starts a new bot and returns at once. Joining happens in the
     * background; progress is reported through webhook events and {@link #get}.
     *
     * @throws ServiceNotConfiguredException if no transcription API key is configured
     * @throws InvalidRequestException if a URL is malformed or not allowed
     * @throws IllegalStateException if no more bots can be started right now
     */
    public BotSnapshot create(String meetingUrl, String webhookUrl, String displayName, String language,
                              Map<String, Object> metadata) {
        String apiKey = transcriptionFactory.settings().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ServiceNotConfiguredException("Deepgram API key not configured");
        }
        validateMeetingUrl(meetingUrl);
        webhookUrlPolicy.validate(webhookUrl);

        String botName = displayName != null && !displayName.isBlank()
                ? displayName.trim() : meetingSettings.getDefaultBotName();
        String effectiveLanguage = language != null && !language.isBlank()
                ? language.trim() : sessionSettings.getDefaultLanguage();

        String id = newBotId();
        MeetingAdapter meeting = meetingAdapterFactory.create(id);
        WebhookDispatcher dispatcher = webhookDeliveryService.openDispatcher(id, webhookUrl.trim());

        BotSession session;
        try {
            session = BotSession.builder()
                    .id(id)
                    .meetingUrl(meetingUrl.trim())
                    .webhookUrl(webhookUrl.trim())
                    .botName(botName)
                    .language(effectiveLanguage)
                    .metadata(metadata)
                    .meeting(meeting)
                    .transcriptionFactory(transcriptionFactory)
                    .audioFormat(transcriptionFactory.settings().audioFormat())
                    .dispatcher(dispatcher)
                    .inboxCapacity(sessionSettings.getInboxCapacity())
                    .leaveTimeout(meetingSettings.getLeaveTimeout())
                    .scheduler(scheduler)
                    .pumpExecutor(transcriptionFactory.executor())
                    .onTerminated(this::scheduleRemoval)
                    .clock(clock)
                    .build();
        } catch (RuntimeException e) {
            dispatcher.cancel();
            meeting.close();
            throw e;
        }

        if (sessions.putIfAbsent(id, session) != null) {
            throw new IllegalStateException("Bot id collision: " + id);
        }

        try {
            sessionExecutor.execute(session);
        } catch (RejectedExecutionException e) {
            sessions.remove(id);
            dispatcher.cancel();
            meeting.close();
            log.warn("[{}] Rejected, maximum number of concurrent bots reached", id);
            throw new IllegalStateException("Maximum number of concurrent bots reached", e);
        }

        log.info("[{}] Bot created for meeting {} (name='{}', language={})", id, meetingUrl, botName, effectiveLanguage);
        return session.snapshot();
    }

    /**
     * @throws BotNotFoundException if the bot is unknown or already purged
     */
    public BotSnapshot get(String botId) {
        return find(botId).snapshot();
    }

    /**
     * Asks the bot to leave its meeting. Repeated calls are harmless.
     *
     * @return the bot's snapshot at the time of the request
     * @throws BotNotFoundException if the bot is unknown or already purged
     */
    public BotSnapshot requestLeave(String botId) {
        BotSession session = find(botId);
        session.requestLeave();
        return session.snapshot();
    }

    public long activeSessionCount() {
        return sessions.values().stream()
                .filter(session -> session.getState() == BotState.IN_MEETING)
                .count();
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        if (sessions.isEmpty()) {
            return;
        }
        log.info("Shutting down {} bot session(s)", sessions.size());
        sessions.values().forEach(BotSession::shutdown);
    }

    private BotSession find(String botId) {
        BotSession session = botId != null ? sessions.get(botId) : null;
        if (session == null) {
            throw new BotNotFoundException(botId);
        }
        return session;
    }

    private void scheduleRemoval(BotSession session) {
        scheduler.schedule(() -> {
            if (sessions.remove(session.getId(), session)) {
                log.info("[{}] Removed from registry", session.getId());
            }
        }, clock.instant().plus(sessionSettings.getRemovalGracePeriod()));
    }

    private String newBotId() {
        String id;
        do {
            id = "bot_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        } while (sessions.containsKey(id));
        return id;
    }

    static void validateMeetingUrl(String meetingUrl) {
        if (meetingUrl == null || meetingUrl.isBlank()) {
            throw new InvalidRequestException("Meeting URL is required");
        }
        URI uri;
        try {
            uri = new URI(meetingUrl.trim());
        } catch (URISyntaxException e) {
            throw new InvalidRequestException("Malformed meeting URL: " + meetingUrl);
        }
        if (!"https".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
            throw new InvalidRequestException("Meeting URL must be an absolute https URL: " + meetingUrl);
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (!isTeamsHost(host, "teams.microsoft.com") && !isTeamsHost(host, "teams.live.com")) {
            throw new InvalidRequestException("Not a Microsoft Teams meeting URL: " + meetingUrl);
        }
    }

    private static boolean isTeamsHost(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }
}
