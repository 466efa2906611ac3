package com.teamsbot.meeting;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the capture script reports on each poll of the Teams page.
 */
@Data
@NoArgsConstructor
class PageSnapshot {

    /** Base64 linear16 chunks captured since the previous poll, oldest first. */
    private List<String> audio = new ArrayList<>();

    private String speakerId;

    private String speakerName;

    private List<Participant> participants = new ArrayList<>();

    @Data
    @NoArgsConstructor
    static class Participant {
        private String id;
        private String name;
    }
}
