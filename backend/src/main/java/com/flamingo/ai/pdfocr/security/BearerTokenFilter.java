package com.flamingo.ai.pdfocr.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <token>} with the configured token.
 * Requests without a matching token pass through unauthenticated and are turned away by the
 * security chain.
 */
@Slf4j
public class BearerTokenFilter extends OncePerRequestFilter {

  static final String BEARER_PREFIX = "Bearer ";
  static final String PRINCIPAL = "api-client";
  static final String ROLE = "ROLE_API";

  private final byte[] expectedToken;

  public BearerTokenFilter(String token) {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("Bearer token must not be blank");
    }
    this.expectedToken = token.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header != null && header.startsWith(BEARER_PREFIX)) {
      if (matches(header)) {
        UsernamePasswordAuthenticationToken authentication =
            new UsernamePasswordAuthenticationToken(
                PRINCIPAL, null, List.of(new SimpleGrantedAuthority(ROLE)));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
      } else {
        log.debug("Bearer token mismatch on {} {}", request.getMethod(), request.getRequestURI());
      }
    }
    filterChain.doFilter(request, response);
  }

  private boolean matches(String header) {
    byte[] presented =
        header.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expectedToken, presented);
  }
}
