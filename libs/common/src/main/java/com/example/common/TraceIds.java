package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

/** イベントへ載せる trace id。HTTP 経由なら RequestMdcInterceptor が入れた値を引き継ぐ。 */
public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_KEY);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    return newTraceId();
  }
}
