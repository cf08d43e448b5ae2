package com.example.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** pick は未指名の枠では null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BoardSlotPayload(
    int pickNumber, String label, int participantIndex, PickResponse pick) {}
