package com.teamsbot.session;

import com.teamsbot.model.TranscriptFragment;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * An item in a session's inbox. Produced by the meeting adapter, the fragment pump, timers and
 * the HTTP layer; consumed only by the session's own task.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class SessionInput {

    enum Type { TRIGGER, FRAGMENT, PARTICIPANT_JOINED, PARTICIPANT_LEFT }

    Type type;
    SessionTrigger trigger;
    String reason;
    TranscriptFragment fragment;
    String participantId;
    String participantName;

    static SessionInput trigger(SessionTrigger trigger, String reason) {
        return new SessionInput(Type.TRIGGER, trigger, reason, null, null, null);
    }

    static SessionInput fragment(TranscriptFragment fragment) {
        return new SessionInput(Type.FRAGMENT, null, null, fragment, null, null);
    }

    static SessionInput participantJoined(String id, String name) {
        return new SessionInput(Type.PARTICIPANT_JOINED, null, null, null, id, name);
    }

    static SessionInput participantLeft(String id, String name) {
        return new SessionInput(Type.PARTICIPANT_LEFT, null, null, null, id, name);
    }

    String reasonOrDefault() {
        return reason != null && !reason.isBlank() ? reason : trigger.defaultMessage();
    }
}
