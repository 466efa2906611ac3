package com.teamsbot.transcription;

import com.teamsbot.model.AudioFormat;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StreamOptions {

    String model;
    String language;
    AudioFormat audioFormat;
    boolean interimResults;
}
