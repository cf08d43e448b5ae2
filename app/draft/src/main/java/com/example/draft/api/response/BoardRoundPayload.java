package com.example.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/** slots は指名順 (偶数ラウンドは participant_index の降順)。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス組み立て専用であり、防御的コピーを行わないため")
public record BoardRoundPayload(int round, List<BoardSlotPayload> slots) {}
