package com.teamsbot.meeting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamsbot.testutil.TestSettings;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class PlaywrightTeamsMeetingAdapterTest {

    private static final String MEETING_URL = "https://teams.microsoft.com/l/meetup-join/abc";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MeetingEventSink sink = mock(MeetingEventSink.class);

    @Test
    void noBrowserThreadFailsTheJoin() {
        PlaywrightTeamsMeetingAdapter adapter = new PlaywrightTeamsMeetingAdapter("bot_1",
                TestSettings.meeting().build(), 16000,
                command -> {
                    throw new RejectedExecutionException("full");
                },
                objectMapper);

        adapter.join(MEETING_URL, "Notetaker", sink);

        verify(sink).joinFailed("No browser capacity available");
        verifyNoMoreInteractions(sink);
    }

    @Test
    void joinsOnlyOnce() {
        List<Runnable> submitted = new ArrayList<>();
        PlaywrightTeamsMeetingAdapter adapter = new PlaywrightTeamsMeetingAdapter("bot_1",
                TestSettings.meeting().build(), 16000, submitted::add, objectMapper);

        adapter.join(MEETING_URL, "Notetaker", sink);

        assertThat(submitted).hasSize(1);
        assertThatThrownBy(() -> adapter.join(MEETING_URL, "Notetaker", sink))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already started");
        assertThat(submitted).hasSize(1);
    }

    @Test
    void leaveAndCloseWithoutJoinAreHarmless() {
        PlaywrightTeamsMeetingAdapter adapter = new PlaywrightTeamsMeetingAdapter("bot_1",
                TestSettings.meeting().build(), 16000, Runnable::run, objectMapper);

        adapter.leave();
        adapter.leave();
        adapter.close();
        adapter.close();
    }

    @Test
    void readsThePageSnapshotWrittenByTheCaptureScript() throws Exception {
        PageSnapshot snapshot = objectMapper.readValue("""
                {"audio": ["AAABAA==", "AgADAA=="],
                 "speakerId": "participant-item-7", "speakerName": "Alice Example",
                 "participants": [{"id": "participant-item-7", "name": "Alice Example"},
                                  {"id": "participant-item-9", "name": "Bob"}]}
                """, PageSnapshot.class);

        assertThat(snapshot.getAudio()).hasSize(2);
        assertThat(snapshot.getSpeakerName()).isEqualTo("Alice Example");
        assertThat(snapshot.getParticipants())
                .extracting(PageSnapshot.Participant::getName)
                .containsExactly("Alice Example", "Bob");
    }

    @Test
    void emptyPageSnapshotHasNoAudioOrParticipants() throws Exception {
        PageSnapshot snapshot = objectMapper.readValue("{\"audio\": [], \"participants\": []}", PageSnapshot.class);

        assertThat(snapshot.getAudio()).isEmpty();
        assertThat(snapshot.getParticipants()).isEmpty();
        assertThat(snapshot.getSpeakerId()).isNull();
    }

    @Test
    void captureScriptIsBuiltForTheStreamSampleRate() {
        assertThat(TeamsPageScripts.audioCapture(16000)).contains("16000");
        assertThat(TeamsPageScripts.audioCapture(48000)).contains("48000");
    }
}
