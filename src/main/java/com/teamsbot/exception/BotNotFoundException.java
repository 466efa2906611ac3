package com.teamsbot.exception;

import lombok.Getter;

@Getter
public class BotNotFoundException extends BotException {

    private final String botId;

    public BotNotFoundException(String botId) {
        super("Bot " + botId + " not found");
        this.botId = botId;
    }
}
