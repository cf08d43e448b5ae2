package com.example.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PickResponse(
    int pickNumber,
    String label,
    int round,
    int pickInRound,
    int participantIndex,
    String participantId,
    String playerId,
    String playerName,
    String position,
    String pickedAt,
    boolean autopick,
    String source) {}
