package com.example.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerResponse(
    String id,
    String name,
    String position,
    String team,
    int byeWeek,
    double adp,
    double projectedPoints) {}
