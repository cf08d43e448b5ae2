package com.example.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス組み立て専用であり、防御的コピーを行わないため")
public record AutodraftConfigResponse(
    String userId,
    boolean enabled,
    Map<String, Integer> positionLimits,
    List<String> customRankings) {}
