package com.flamingo.ai.pdfocr.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfocr.exception.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

/** Answers unauthenticated requests with 401 and the standard {@link ApiError} body. */
@RequiredArgsConstructor
@Slf4j
public class BearerAuthenticationEntryPoint implements AuthenticationEntryPoint {

  static final String MESSAGE = "Missing or invalid bearer token";

  private final ObjectMapper objectMapper;

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    log.warn(
        "Rejected unauthenticated request {} {}", request.getMethod(), request.getRequestURI());
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    ApiError error =
        ApiError.builder()
            .errorId(UUID.randomUUID().toString().substring(0, 8))
            .code(ApiError.UNAUTHORIZED)
            .message(MESSAGE)
            .path(request.getRequestURI())
            .timestamp(Instant.now())
            .build();
    objectMapper.writeValue(response.getOutputStream(), error);
  }
}
