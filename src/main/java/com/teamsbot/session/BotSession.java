package com.teamsbot.session;

import com.teamsbot.exception.StreamFailureException;
import com.teamsbot.meeting.MeetingAdapter;
import com.teamsbot.meeting.MeetingEventSink;
import com.teamsbot.model.AudioChunk;
import com.teamsbot.model.AudioFormat;
import com.teamsbot.model.BotSnapshot;
import com.teamsbot.model.BotState;
import com.teamsbot.model.TranscriptFragment;
import com.teamsbot.model.WebhookEvent;
import com.teamsbot.transcription.FragmentStream;
import com.teamsbot.transcription.TranscriptionStreamAdapter;
import com.teamsbot.transcription.TranscriptionStreamFactory;
import com.teamsbot.webhook.WebhookDispatcher;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One bot in one meeting.
 *
 * <p>{@link #run()} is the session task: it drains the inbox and applies {@link BotStateMachine}
 * until a terminal state is reached, then releases the meeting and the transcription stream.
 * Only that task changes the session's state. Meeting callbacks, the fragment pump, timers and
 * leave requests all go through the inbox.
 */
@Slf4j
public class BotSession implements MeetingEventSink, Runnable {

    private static final long ENQUEUE_TIMEOUT_MILLIS = 1000;
    private static final long PUMP_RETRY_MILLIS = 200;

    @Getter
    private final String id;
    @Getter
    private final String meetingUrl;
    @Getter
    private final String webhookUrl;
    @Getter
    private final String botName;
    @Getter
    private final String language;
    @Getter
    private final Instant createdAt;

    private final Map<String, Object> metadata;
    private final MeetingAdapter meeting;
    private final TranscriptionStreamFactory transcriptionFactory;
    private final AudioFormat audioFormat;
    private final WebhookDispatcher dispatcher;
    private final Duration leaveTimeout;
    private final TaskScheduler scheduler;
    private final Executor pumpExecutor;
    private final Consumer<BotSession> onTerminated;
    private final Clock clock;

    private final BlockingQueue<SessionInput> inbox;
    private final AtomicBoolean leaveRequested = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicBoolean transcriptionClosed = new AtomicBoolean();
    // speaker id -> display name, owned by the session task
    private final Map<String, String> participants = new HashMap<>();

    private volatile BotState state = BotState.JOINING;
    private volatile Instant endedAt;
    private volatile String errorMessage;
    private volatile TranscriptionStreamAdapter transcription;
    private volatile ScheduledFuture<?> leaveTimer;

    @Builder
    private BotSession(String id, String meetingUrl, String webhookUrl, String botName, String language,
                       Map<String, Object> metadata, MeetingAdapter meeting,
                       TranscriptionStreamFactory transcriptionFactory, AudioFormat audioFormat,
                       WebhookDispatcher dispatcher, int inboxCapacity, Duration leaveTimeout,
                       TaskScheduler scheduler, Executor pumpExecutor, Consumer<BotSession> onTerminated,
                       Clock clock) {
        this.id = id;
        this.meetingUrl = meetingUrl;
        this.webhookUrl = webhookUrl;
        this.botName = botName;
        this.language = language;
        // JSON metadata may carry null values, which Map.copyOf rejects
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        this.meeting = meeting;
        this.transcriptionFactory = transcriptionFactory;
        this.audioFormat = audioFormat;
        this.dispatcher = dispatcher;
        this.leaveTimeout = leaveTimeout;
        this.scheduler = scheduler;
        this.pumpExecutor = pumpExecutor;
        this.onTerminated = onTerminated != null ? onTerminated : session -> { };
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.inbox = new ArrayBlockingQueue<>(inboxCapacity > 0 ? inboxCapacity : 1000);
        this.createdAt = this.clock.instant();
    }

    public BotState getState() {
        return state;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public BotSnapshot snapshot() {
        return BotSnapshot.builder()
                .id(id)
                .state(state)
                .meetingUrl(meetingUrl)
                .webhookUrl(webhookUrl)
                .botName(botName)
                .language(language)
                .createdAt(createdAt)
                .endedAt(endedAt)
                .errorMessage(errorMessage)
                .build();
    }

    @Override
    public void run() {
        log.info("[{}] Session started for meeting {}", id, meetingUrl);
        try {
            emitStatus(BotState.JOINING, "Joining meeting");
            meeting.join(meetingUrl, botName, this);
            while (!state.isTerminal()) {
                handle(inbox.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Session task interrupted in state {}", id, state);
            fault("Session interrupted");
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error in state {}: {}", id, state, e.getMessage(), e);
            fault("Internal error: " + e.getMessage());
        } finally {
            finish();
        }
    }

    /**
     * Asks the bot to leave. Only the first call has an effect.
     */
    public void requestLeave() {
        if (leaveRequested.compareAndSet(false, true)) {
            log.info("[{}] Leave requested in state {}", id, state);
            enqueue(SessionInput.trigger(SessionTrigger.LEAVE_REQUESTED, null));
        }
    }

    /**
     * Application shutdown: leave, and drop webhook events that have not started sending yet.
     */
    public void shutdown() {
        requestLeave();
        dispatcher.cancel();
    }

    // ---- meeting callbacks, any thread ----

    @Override
    public void joined() {
        enqueue(SessionInput.trigger(SessionTrigger.JOINED, null));
    }

    @Override
    public void joinFailed(String reason) {
        enqueue(SessionInput.trigger(SessionTrigger.JOIN_FAILED, reason));
    }

    @Override
    public void audio(AudioChunk chunk) {
        TranscriptionStreamAdapter stream = transcription;
        if (state == BotState.IN_MEETING && stream != null) {
            stream.send(chunk);
        }
    }

    @Override
    public void participantJoined(String participantId, String displayName) {
        enqueue(SessionInput.participantJoined(participantId, displayName));
    }

    @Override
    public void participantLeft(String participantId, String displayName) {
        enqueue(SessionInput.participantLeft(participantId, displayName));
    }

    @Override
    public void ended() {
        enqueue(SessionInput.trigger(SessionTrigger.MEETING_ENDED, null));
    }

    @Override
    public void removed() {
        enqueue(SessionInput.trigger(SessionTrigger.REMOVED, null));
    }

    @Override
    public void error(String reason) {
        enqueue(SessionInput.trigger(SessionTrigger.MEETING_ERROR, reason));
    }

    @Override
    public void left() {
        enqueue(SessionInput.trigger(SessionTrigger.LEFT_CONFIRMED, null));
    }

    // ---- session task ----

    private void handle(SessionInput input) {
        switch (input.getType()) {
            case TRIGGER -> apply(input.getTrigger(), input.reasonOrDefault());
            case FRAGMENT -> deliverFragment(input.getFragment());
            case PARTICIPANT_JOINED -> {
                if (input.getParticipantId() != null && input.getParticipantName() != null) {
                    participants.put(input.getParticipantId(), input.getParticipantName());
                }
                log.info("[{}] Participant joined: {}", id, input.getParticipantName());
            }
            // names stay known so late fragments can still be attributed
            case PARTICIPANT_LEFT -> log.info("[{}] Participant left: {}", id, input.getParticipantName());
        }
    }

    private void apply(SessionTrigger trigger, String reason) {
        BotState from = state;
        Optional<BotState> next = BotStateMachine.next(from, trigger);
        if (next.isEmpty()) {
            log.debug("[{}] Ignoring {} in state {}", id, trigger, from);
            return;
        }
        BotState to = next.get();
        state = to;
        log.info("[{}] {} -> {} ({})", id, from, to, trigger);

        switch (to) {
            case IN_MEETING -> enterInMeeting();
            case LEAVING -> enterLeaving();
            case LEFT -> {
                endedAt = clock.instant();
                emitStatus(BotState.LEFT, reason);
            }
            case ERROR -> {
                endedAt = clock.instant();
                errorMessage = reason;
                emitStatus(BotState.ERROR, reason);
            }
            case JOINING -> throw new IllegalStateException("No transition leads back to JOINING");
        }
    }

    private void fault(String reason) {
        if (!state.isTerminal()) {
            apply(SessionTrigger.INTERNAL_FAULT, reason);
        }
    }

    private void enterInMeeting() {
        // status first, so it precedes every transcription event
        emitStatus(BotState.IN_MEETING, "Joined meeting");

        TranscriptionStreamAdapter stream = transcriptionFactory.create(id, language);
        FragmentStream fragments;
        try {
            fragments = stream.open(audioFormat);
        } catch (StreamFailureException e) {
            log.error("[{}] Could not open transcription stream: {}", id, e.getMessage());
            apply(SessionTrigger.STREAM_FAILED, "Transcription unavailable: " + e.getMessage());
            return;
        }
        transcription = stream;

        try {
            pumpExecutor.execute(() -> pump(stream, fragments));
        } catch (RejectedExecutionException e) {
            log.error("[{}] No thread available for the transcription pump", id);
            apply(SessionTrigger.STREAM_FAILED, "Transcription capacity exhausted");
        }
    }

    private void enterLeaving() {
        emitStatus(BotState.LEAVING, "Leaving meeting");
        closeTranscription();
        meeting.leave();
        leaveTimer = scheduler.schedule(
                () -> enqueue(SessionInput.trigger(SessionTrigger.LEAVE_TIMEOUT, null)),
                clock.instant().plus(leaveTimeout));
    }

    private void deliverFragment(TranscriptFragment fragment) {
        if (state != BotState.IN_MEETING) {
            log.debug("[{}] Dropping fragment received in state {}", id, state);
            return;
        }
        TranscriptFragment named = fragment;
        if (fragment.getSpeakerName() == null && participants.containsKey(fragment.getSpeakerId())) {
            named = fragment.toBuilder().speakerName(participants.get(fragment.getSpeakerId())).build();
        }
        dispatcher.dispatch(WebhookEvent.transcription(id, named, metadata, clock.instant()));
    }

    private void emitStatus(BotState status, String message) {
        dispatcher.dispatch(WebhookEvent.botStatus(id, status, message, metadata, clock.instant()));
    }

    /**
     * Moves fragments from the transcription stream into the inbox until the stream ends, then
     * reports a terminal stream failure if there was one.
     */
    private void pump(TranscriptionStreamAdapter stream, FragmentStream fragments) {
        try {
            while (fragments.hasNext()) {
                SessionInput input = SessionInput.fragment(fragments.next());
                while (!inbox.offer(input, PUMP_RETRY_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (finished.get()) {
                        return;
                    }
                }
            }
            stream.failure().ifPresent(cause ->
                    enqueue(SessionInput.trigger(SessionTrigger.STREAM_FAILED, cause.getMessage())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Fragment pump interrupted", id);
        }
    }

    private void enqueue(SessionInput input) {
        if (finished.get()) {
            return;
        }
        try {
            if (!inbox.offer(input, ENQUEUE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.error("[{}] Inbox full, dropping {} {}", id, input.getType(), input.getTrigger());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while queueing {}", id, input.getType());
        }
    }

    private void closeTranscription() {
        TranscriptionStreamAdapter stream = transcription;
        if (stream != null && transcriptionClosed.compareAndSet(false, true)) {
            stream.close();
        }
    }

    private void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> timer = leaveTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        closeTranscription();
        try {
            meeting.close();
        } catch (RuntimeException e) {
            log.warn("[{}] Error closing meeting adapter: {}", id, e.getMessage());
        }
        dispatcher.complete();
        if (endedAt == null) {
            endedAt = clock.instant();
        }
        log.info("[{}] Session finished in state {}", id, state);
        onTerminated.accept(this);
    }
}
