package com.teamsbot.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamsbot.config.TranscriptionSettings;
import com.teamsbot.exception.StreamFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
/**
 * Deepgram live transcription over a WebSocket. Audio goes out as binary frames; results come
 * back as JSON text frames.
 */
@Slf4j
@Component
public class DeepgramTranscriptionBackend implements TranscriptionBackend {

    static final String KEEP_ALIVE = "{\"type\":\"KeepAlive\"}";
    static final String CLOSE_STREAM = "{\"type\":\"CloseStream\"}";

    private final WebSocketClient webSocketClient;
    private final TranscriptionSettings settings;
    private final DeepgramResultParser parser;

    public DeepgramTranscriptionBackend(WebSocketClient webSocketClient, TranscriptionSettings settings,
                                        ObjectMapper objectMapper) {
        this.webSocketClient = webSocketClient;
        this.settings = settings;
        this.parser = new DeepgramResultParser(objectMapper);
    }

    @Override
    public BackendConnection connect(StreamOptions options, BackendListener listener) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new StreamFailureException("Deepgram API key not configured");
        }

        URI uri = buildUri(options);
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + settings.getApiKey());

        DeepgramConnection connection = new DeepgramConnection();
        Sinks.Empty<Void> opened = Sinks.empty();

        Disposable subscription = webSocketClient.execute(uri, headers, session -> {
                    opened.tryEmitEmpty();
                    return handle(session, connection, listener);
                })
                .subscribe(
                        unused -> { },
                        error -> {
                            if (opened.tryEmitError(error).isFailure() && !connection.isClosing()) {
                                listener.onDisconnect(error);
                            }
                            connection.markClosed();
                        },
                        () -> {
                            if (!connection.isClosing()) {
                                listener.onDisconnect(null);
                            }
                            connection.markClosed();
                        });

        try {
            opened.asMono().block(settings.getConnectTimeout());
        } catch (RuntimeException e) {
            // a handshake still in flight would otherwise open a socket nobody owns
            subscription.dispose();
            connection.close();
            throw new StreamFailureException("Deepgram handshake failed: " + describe(e), e);
        }
        log.debug("Deepgram connection established: {}", uri.getPath());
        return connection;
    }

    private Mono<Void> handle(WebSocketSession session, DeepgramConnection connection, BackendListener listener) {
        Flux<WebSocketMessage> audio = connection.audio()
                .map(pcm -> session.binaryMessage(factory -> factory.wrap(pcm)));
        Flux<WebSocketMessage> keepAlive = Flux.interval(settings.getKeepAliveInterval())
                .map(tick -> session.textMessage(KEEP_ALIVE));

        Flux<WebSocketMessage> outbound = Flux.merge(audio, keepAlive)
                .takeUntilOther(connection.closeRequested())
                .concatWith(Mono.fromSupplier(() -> session.textMessage(CLOSE_STREAM)));

        Mono<Void> inbound = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(text -> onMessage(text, listener))
                .then();

        return Mono.when(session.send(outbound), inbound);
    }

    private void onMessage(String text, BackendListener listener) {
        try {
            parser.parse(text).ifPresent(listener::onResult);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed Deepgram message: {}", e.getOriginalMessage());
        }
    }

    URI buildUri(StreamOptions options) {
        return UriComponentsBuilder.fromUriString(settings.getUrl())
                .queryParam("model", options.getModel())
                .queryParam("language", options.getLanguage())
                .queryParam("encoding", options.getAudioFormat().getEncoding())
                .queryParam("sample_rate", options.getAudioFormat().getSampleRate())
                .queryParam("channels", options.getAudioFormat().getChannels())
                .queryParam("interim_results", options.isInterimResults())
                .queryParam("smart_format", true)
                .build()
                .toUri();
    }

    private static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
