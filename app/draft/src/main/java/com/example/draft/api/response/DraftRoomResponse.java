package com.example.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス組み立て専用であり、防御的コピーを行わないため")
public record DraftRoomResponse(
    String roomId,
    String name,
    String status,
    int teamCount,
    int rosterSize,
    int pickTimeSeconds,
    int gracePeriodSeconds,
    List<ParticipantPayload> participants) {}
