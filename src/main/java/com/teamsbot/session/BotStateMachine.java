package com.teamsbot.session;

import com.teamsbot.model.BotState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.teamsbot.model.BotState.ERROR;
import static com.teamsbot.model.BotState.IN_MEETING;
import static com.teamsbot.model.BotState.JOINING;
import static com.teamsbot.model.BotState.LEAVING;
import static com.teamsbot.model.BotState.LEFT;
import static com.teamsbot.session.SessionTrigger.INTERNAL_FAULT;
import static com.teamsbot.session.SessionTrigger.JOINED;
import static com.teamsbot.session.SessionTrigger.JOIN_FAILED;
import static com.teamsbot.session.SessionTrigger.LEAVE_REQUESTED;
import static com.teamsbot.session.SessionTrigger.LEAVE_TIMEOUT;
import static com.teamsbot.session.SessionTrigger.LEFT_CONFIRMED;
import static com.teamsbot.session.SessionTrigger.MEETING_ENDED;
import static com.teamsbot.session.SessionTrigger.MEETING_ERROR;
import static com.teamsbot.session.SessionTrigger.REMOVED;
import static com.teamsbot.session.SessionTrigger.STREAM_FAILED;

/**
 * The bot lifecycle as a transition table. {@code LEFT} and {@code ERROR} are absorbing; any
 * (state, trigger) pair not listed is not a transition.
 */
public final class BotStateMachine {

    private static final Map<BotState, Map<SessionTrigger, BotState>> TRANSITIONS = new EnumMap<>(BotState.class);

    static {
        Map<SessionTrigger, BotState> joining = new EnumMap<>(SessionTrigger.class);
        joining.put(JOINED, IN_MEETING);
        joining.put(JOIN_FAILED, ERROR);
        joining.put(LEAVE_REQUESTED, LEAVING);
        joining.put(MEETING_ERROR, ERROR);
        joining.put(INTERNAL_FAULT, ERROR);

        Map<SessionTrigger, BotState> inMeeting = new EnumMap<>(SessionTrigger.class);
        inMeeting.put(LEAVE_REQUESTED, LEAVING);
        inMeeting.put(MEETING_ENDED, LEFT);
        inMeeting.put(REMOVED, LEFT);
        inMeeting.put(MEETING_ERROR, ERROR);
        inMeeting.put(STREAM_FAILED, ERROR);
        inMeeting.put(INTERNAL_FAULT, ERROR);

        Map<SessionTrigger, BotState> leaving = new EnumMap<>(SessionTrigger.class);
        leaving.put(LEFT_CONFIRMED, LEFT);
        leaving.put(MEETING_ENDED, LEFT);
        leaving.put(REMOVED, LEFT);
        leaving.put(LEAVE_TIMEOUT, LEFT);
        leaving.put(MEETING_ERROR, ERROR);
        leaving.put(INTERNAL_FAULT, ERROR);

        TRANSITIONS.put(JOINING, Collections.unmodifiableMap(joining));
        TRANSITIONS.put(IN_MEETING, Collections.unmodifiableMap(inMeeting));
        TRANSITIONS.put(LEAVING, Collections.unmodifiableMap(leaving));
        TRANSITIONS.put(LEFT, Collections.emptyMap());
        TRANSITIONS.put(ERROR, Collections.emptyMap());
    }

    private BotStateMachine() {
    }

    /**
     * @return the state {@code trigger} leads to from {@code state}, empty if it is ignored there
     */
    public static Optional<BotState> next(BotState state, SessionTrigger trigger) {
        return Optional.ofNullable(TRANSITIONS.get(state).get(trigger));
    }
}
