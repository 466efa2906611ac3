package com.teamsbot.meeting;

/**
 * Joins a single meeting on behalf of one bot. Adapters are single-use.
 *
 * <p>Meeting-side disconnects are reported to the sink and never retried by the adapter.
 */
public interface MeetingAdapter extends AutoCloseable {

    /**
     * Starts joining in the background and returns immediately. The outcome is reported through
     * {@link MeetingEventSink#joined()} or {@link MeetingEventSink#joinFailed(String)}.
     */
    void join(String meetingUrl, String displayName, MeetingEventSink sink);

    /**
     * Asks the adapter to hang up. Completion is reported through {@link MeetingEventSink#left()}.
     * Also aborts a join that has not completed yet.
     */
    void leave();

    /**
     * Releases the browser. No sink callbacks are made afterwards. Idempotent.
     */
    @Override
    void close();
}
