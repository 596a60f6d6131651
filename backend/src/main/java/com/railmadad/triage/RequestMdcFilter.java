package com.railmadad.triage;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
  static final String CHANNEL_MDC_KEY = "channel";
  static final String CHANNEL_HEADER = "X-Channel";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId == null || correlationId.isBlank()) {
        correlationId = UUID.randomUUID().toString();
      }
      MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      response.setHeader(CORRELATION_ID_HEADER, correlationId);

      MDC.put(CHANNEL_MDC_KEY, channelOf(request));

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_MDC_KEY);
      MDC.remove(CHANNEL_MDC_KEY);
    }
  }

  private static String channelOf(HttpServletRequest request) {
    String channel = request.getHeader(CHANNEL_HEADER);
    if (channel != null && !channel.isBlank()) {
      return channel.trim();
    }
    String uri = request.getRequestURI();
    return uri != null && uri.startsWith("/api/chat") ? "chat" : "web";
  }
}
