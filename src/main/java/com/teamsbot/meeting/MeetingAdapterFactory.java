package com.teamsbot.meeting;

public interface MeetingAdapterFactory {

    MeetingAdapter create(String botId);
}
