/*
 * どこで: Draft Web 設定
 * 何を: リクエスト単位で request_id/user_id/room_id などを MDC へ積み、完了時に外す
 * なぜ: 指名 API のログをリクエストとルームで追えるようにするため
 */
package com.example.draft.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  public static final String USER_ID_HEADER = "X-User-Id";
  public static final String REQUEST_ID_HEADER = "X-Request-Id";

  private static final String MDC_KEYS_ATTRIBUTE =
      RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> pushed = new ArrayList<>();
    final String requestId = requestIdOrNew(request.getHeader(REQUEST_ID_HEADER));
    push(pushed, "request_id", requestId);
    // イベントの trace_id は HTTP の request_id を引き継ぐ
    push(pushed, TraceIds.MDC_KEY, requestId);
    push(pushed, "http_method", request.getMethod());
    push(pushed, "http_path", request.getRequestURI());
    push(pushed, "client_ip", clientIp(request));
    push(pushed, "user_id", request.getHeader(USER_ID_HEADER));
    push(pushed, "room_id", pathVariable(request, "roomId"));
    request.setAttribute(MDC_KEYS_ATTRIBUTE, pushed);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(MDC_KEYS_ATTRIBUTE) instanceof List<?> pushed) {
      pushed.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private static String requestIdOrNew(@Nullable String requestId) {
    return requestId == null || requestId.isBlank() ? TraceIds.newTraceId() : requestId;
  }

  /** X-Forwarded-For の先頭 (クライアント側) を優先する。 */
  private static String clientIp(HttpServletRequest request) {
    final String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor == null || forwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwardedFor.split(",", 2)[0].trim();
  }

  @Nullable
  private static String pathVariable(HttpServletRequest request, String name) {
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables) {
      final Object value = variables.get(name);
      return value == null ? null : value.toString();
    }
    return null;
  }

  private static void push(List<String> pushed, String key, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
      pushed.add(key);
    }
  }
}
