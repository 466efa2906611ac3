package com.teamsbot.transcription;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Who was speaking at which point of the meeting audio, recorded as audio is streamed.
 */
class SpeakerTimeline {

    static final String UNKNOWN_SPEAKER = "unknown";

    static final class Speaker {
        final String id;
        final String name;

        Speaker(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }

    private final TreeMap<Long, Speaker> changes = new TreeMap<>();

    synchronized void record(long offsetMs, String speakerId, String speakerName) {
        if (speakerId == null) {
            return;
        }
        Map.Entry<Long, Speaker> current = changes.floorEntry(offsetMs);
        if (current != null && current.getValue().id.equals(speakerId)
                && Objects.equals(current.getValue().name, speakerName)) {
            return;
        }
        changes.put(offsetMs, new Speaker(speakerId, speakerName));
    }

    synchronized Speaker speakerAt(long offsetMs) {
        Map.Entry<Long, Speaker> entry = changes.floorEntry(offsetMs);
        if (entry == null) {
            entry = changes.firstEntry();
        }
        return entry != null ? entry.getValue() : new Speaker(UNKNOWN_SPEAKER, null);
    }
}
