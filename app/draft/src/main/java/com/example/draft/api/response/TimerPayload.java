package com.example.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** display は M:SS、progress は残り時間の割合 (%)。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimerPayload(
    int secondsRemaining,
    String display,
    String urgency,
    double progress,
    boolean running,
    boolean paused,
    boolean inGracePeriod,
    boolean expired) {}
