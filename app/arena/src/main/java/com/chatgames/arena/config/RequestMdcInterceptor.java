/*
 * どこで: Arena Web 設定
 * 何を: リクエスト単位で request/user/channel などの運用キーを MDC に載せ、完了時に外す
 * なぜ: ディスパッチャ以降のログを、どのチャンネルの誰の操作かで引けるようにするため
 */
package com.chatgames.arena.config;

import com.chatgames.common.Ids;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String PUT_KEYS_ATTRIBUTE =
      RequestMdcInterceptor.class.getName() + ".PUT_KEYS";

  // パス変数名 -> MDC キー
  private static final Map<String, String> PATH_VARIABLE_KEYS =
      Map.of("channelId", "channel_id", "confirmationId", "confirmation_id");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> values = new LinkedHashMap<>();
    values.put("request_id", requestIdOf(request));
    values.put("http_method", request.getMethod());
    values.put("http_path", request.getRequestURI());
    values.put("client_ip", clientIpOf(request));
    values.put("user_id", request.getHeader("X-User-Id"));
    final Map<?, ?> pathVariables = pathVariablesOf(request);
    PATH_VARIABLE_KEYS.forEach(
        (variable, key) -> {
          final Object value = pathVariables.get(variable);
          values.put(key, value == null ? null : value.toString());
        });

    final List<String> putKeys = new ArrayList<>();
    values.forEach(
        (key, value) -> {
          if (value != null && !value.isBlank()) {
            MDC.put(key, value);
            putKeys.add(key);
          }
        });
    request.setAttribute(PUT_KEYS_ATTRIBUTE, putKeys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(PUT_KEYS_ATTRIBUTE) instanceof List<?> putKeys) {
      putKeys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private String requestIdOf(HttpServletRequest request) {
    final String header = request.getHeader("X-Request-Id");
    return header == null || header.isBlank() ? Ids.newTraceId() : header;
  }

  // プロキシ経由では X-Forwarded-For の先頭が元のクライアント
  private String clientIpOf(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  // URI テンプレート変数はハンドラ解決後にだけ入る
  private Map<?, ?> pathVariablesOf(HttpServletRequest request) {
    final Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return variables instanceof Map<?, ?> map ? map : Map.of();
  }
}
