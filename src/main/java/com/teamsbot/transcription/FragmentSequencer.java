package com.teamsbot.transcription;

import com.teamsbot.model.TranscriptFragment;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns connection-relative backend results into meeting-relative fragments and enforces the
 * fragment ordering rules across reconnects:
 * <ul>
 *   <li>a final fragment ending at or before the last final's end is never reissued;</li>
 *   <li>a partial starting before the last final's end is stale and suppressed;</li>
 *   <li>the partial in flight when a connection drops is forgotten.</li>
 * </ul>
 */
@Slf4j
class FragmentSequencer {

    private final String botId;
    private final boolean interimResults;

    private long lastFinalEndMs = -1;
    private TranscriptFragment pendingPartial;

    FragmentSequencer(String botId, boolean interimResults) {
        this.botId = botId;
        this.interimResults = interimResults;
    }

    /**
     * @return the fragment to emit, or null if the result must not be emitted
     */
    synchronized TranscriptFragment accept(BackendResult result, long connectionOffsetMs, SpeakerTimeline speakers) {
        String text = result.getText() != null ? result.getText().trim() : "";
        if (text.isEmpty()) {
            return null;
        }

        long startMs = connectionOffsetMs + result.getStartMs();
        long endMs = startMs + result.getDurationMs();

        if (result.isFinal()) {
            if (endMs <= lastFinalEndMs) {
                log.debug("[{}] Skipping final already emitted up to {} ms: '{}'", botId, lastFinalEndMs, text);
                return null;
            }
            lastFinalEndMs = endMs;
            pendingPartial = null;
        } else {
            if (!interimResults || startMs < lastFinalEndMs) {
                return null;
            }
        }

        SpeakerTimeline.Speaker speaker = speakers.speakerAt(startMs);
        TranscriptFragment fragment = TranscriptFragment.builder()
                .speakerId(speaker.id)
                .speakerName(speaker.name)
                .text(text)
                .startMs(startMs)
                .durationMs(result.getDurationMs())
                .isFinal(result.isFinal())
                .build();

        if (!fragment.isFinal()) {
            pendingPartial = fragment;
        }
        return fragment;
    }

    synchronized void discardPartial() {
        if (pendingPartial != null) {
            log.debug("[{}] Discarding in-flight partial '{}'", botId, pendingPartial.getText());
            pendingPartial = null;
        }
    }

    synchronized TranscriptFragment pendingPartial() {
        return pendingPartial;
    }

    synchronized long lastFinalEndMs() {
        return lastFinalEndMs;
    }
}
