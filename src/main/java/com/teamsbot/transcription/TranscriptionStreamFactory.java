package com.teamsbot.transcription;

import com.teamsbot.config.TranscriptionSettings;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Creates the transcription stream for each bot session.
 */
@Component
public class TranscriptionStreamFactory {

    private final TranscriptionBackend backend;
    private final TranscriptionSettings settings;
    private final Executor executor;

    public TranscriptionStreamFactory(TranscriptionBackend backend,
                                      TranscriptionSettings settings,
                                      @Qualifier("transcriptionExecutor") Executor executor) {
        this.backend = backend;
        this.settings = settings;
        this.executor = executor;
    }

    public TranscriptionStreamAdapter create(String botId, String language) {
        String effectiveLanguage = language != null && !language.isBlank() ? language : settings.getLanguage();
        return new TranscriptionStreamAdapter(botId, effectiveLanguage, backend, settings, executor);
    }

    public TranscriptionSettings settings() {
        return settings;
    }

    public Executor executor() {
        return executor;
    }
}
