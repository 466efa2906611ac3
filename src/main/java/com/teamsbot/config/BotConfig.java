package com.teamsbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Reads the {@code bot.*} properties once at startup and exposes them as immutable settings beans.
 */
@Configuration
public class BotConfig {

    @Value("${bot.webhook.timeout:30s}")
    private Duration webhookTimeout;

    @Value("${bot.webhook.retry-count:3}")
    private int webhookRetryCount;

    @Value("${bot.webhook.backoff-base:500ms}")
    private Duration webhookBackoffBase;

    @Value("${bot.webhook.backoff-max:10s}")
    private Duration webhookBackoffMax;

    @Value("${bot.webhook.allow-insecure:false}")
    private boolean webhookAllowInsecure;

    @Value("${bot.webhook.allow-private-hosts:false}")
    private boolean webhookAllowPrivateHosts;

    @Value("${bot.webhook.queue-capacity:1024}")
    private int webhookQueueCapacity;

    @Value("${bot.transcription.api-key:}")
    private String deepgramApiKey;

    @Value("${bot.transcription.url:wss://api.deepgram.com/v1/listen}")
    private String deepgramUrl;

    @Value("${bot.transcription.model:nova-2}")
    private String deepgramModel;

    @Value("${bot.transcription.language:en}")
    private String deepgramLanguage;

    @Value("${bot.transcription.sample-rate:16000}")
    private int sampleRate;

    @Value("${bot.transcription.interim-results:true}")
    private boolean interimResults;

    @Value("${bot.transcription.connect-timeout:10s}")
    private Duration connectTimeout;

    @Value("${bot.transcription.keep-alive-interval:5s}")
    private Duration keepAliveInterval;

    @Value("${bot.transcription.reconnect-attempts:3}")
    private int reconnectAttempts;

    @Value("${bot.transcription.reconnect-base-delay:500ms}")
    private Duration reconnectBaseDelay;

    @Value("${bot.transcription.reconnect-max-delay:5s}")
    private Duration reconnectMaxDelay;

    @Value("${bot.transcription.buffer-capacity:500}")
    private int bufferCapacity;

    @Value("${bot.transcription.reconnect-buffer-policy:FLUSH}")
    private TranscriptionSettings.ReconnectBufferPolicy bufferPolicy;

    @Value("${bot.meeting.default-bot-name:Transcription Bot}")
    private String defaultBotName;

    @Value("${bot.meeting.headless:true}")
    private boolean headless;

    @Value("${bot.meeting.slow-mo:0}")
    private int slowMo;

    @Value("${bot.meeting.viewport-width:1920}")
    private int viewportWidth;

    @Value("${bot.meeting.viewport-height:1080}")
    private int viewportHeight;

    @Value("${bot.meeting.join-timeout:120s}")
    private Duration joinTimeout;

    @Value("${bot.meeting.leave-timeout:30s}")
    private Duration leaveTimeout;

    @Value("${bot.meeting.poll-interval:100ms}")
    private Duration pollInterval;

    @Value("${bot.meeting.verify-browser-on-startup:false}")
    private boolean verifyBrowserOnStartup;

    @Value("${bot.session.removal-grace-period:30s}")
    private Duration removalGracePeriod;

    @Value("${bot.session.inbox-capacity:1000}")
    private int inboxCapacity;

    @Bean
    public WebhookSettings webhookSettings() {
        if (webhookRetryCount < 1) {
            throw new IllegalArgumentException("bot.webhook.retry-count must be >= 1");
        }
        return WebhookSettings.builder()
                .timeout(webhookTimeout)
                .retryCount(webhookRetryCount)
                .backoffBase(webhookBackoffBase)
                .backoffMax(webhookBackoffMax)
                .allowInsecure(webhookAllowInsecure)
                .allowPrivateHosts(webhookAllowPrivateHosts)
                .queueCapacity(webhookQueueCapacity)
                .build();
    }

    @Bean
    public TranscriptionSettings transcriptionSettings() {
        return TranscriptionSettings.builder()
                .apiKey(deepgramApiKey)
                .url(deepgramUrl)
                .model(deepgramModel)
                .language(deepgramLanguage)
                .sampleRate(sampleRate)
                .interimResults(interimResults)
                .connectTimeout(connectTimeout)
                .keepAliveInterval(keepAliveInterval)
                .reconnectAttempts(reconnectAttempts)
                .reconnectBaseDelay(reconnectBaseDelay)
                .reconnectMaxDelay(reconnectMaxDelay)
                .bufferCapacity(bufferCapacity)
                .bufferPolicy(bufferPolicy)
                .build();
    }

    @Bean
    public MeetingSettings meetingSettings() {
        return MeetingSettings.builder()
                .defaultBotName(defaultBotName)
                .headless(headless)
                .slowMo(slowMo)
                .viewportWidth(viewportWidth)
                .viewportHeight(viewportHeight)
                .joinTimeout(joinTimeout)
                .leaveTimeout(leaveTimeout)
                .pollInterval(pollInterval)
                .verifyBrowserOnStartup(verifyBrowserOnStartup)
                .build();
    }

    @Bean
    public SessionSettings sessionSettings() {
        return SessionSettings.builder()
                .removalGracePeriod(removalGracePeriod)
                .inboxCapacity(inboxCapacity)
                .defaultLanguage(deepgramLanguage)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
