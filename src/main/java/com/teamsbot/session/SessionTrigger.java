package com.teamsbot.session;

/**
 * Everything that can move a bot session between states.
 */
public enum SessionTrigger {
    JOINED("Joined meeting"),
    JOIN_FAILED("Failed to join meeting"),
    LEAVE_REQUESTED("Leave requested"),
    LEFT_CONFIRMED("Left meeting"),
    MEETING_ENDED("Meeting ended"),
    REMOVED("Removed from meeting"),
    MEETING_ERROR("Meeting error"),
    STREAM_FAILED("Transcription stream failed"),
    LEAVE_TIMEOUT("Leave not confirmed in time"),
    INTERNAL_FAULT("Internal error");

    private final String defaultMessage;

    SessionTrigger(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
