package com.flamingo.ai.pdfocr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfocr.security.BearerAuthenticationEntryPoint;
import com.flamingo.ai.pdfocr.security.BearerTokenFilter;
import jakarta.servlet.DispatcherType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Stateless bearer token security. {@code /health} is always open; every other endpoint needs the
 * configured token, unless the token is blank.
 */
@Configuration
@EnableWebSecurity
@Slf4j
public class SecurityConfig {

  static final String[] PUBLIC_PATHS = {"/health", "/health/**"};

  @Bean
  public BearerAuthenticationEntryPoint bearerAuthenticationEntryPoint(ObjectMapper objectMapper) {
    return new BearerAuthenticationEntryPoint(objectMapper);
  }

  @Bean
  public SecurityFilterChain apiSecurityFilterChain(
      HttpSecurity http, OcrConfig ocrConfig, BearerAuthenticationEntryPoint entryPoint)
      throws Exception {
    http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .requestCache(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable)
        .exceptionHandling(e -> e.authenticationEntryPoint(entryPoint));

    OcrConfig.Auth auth = ocrConfig.getAuth();
    if (!auth.isEnabled()) {
      log.warn("No auth token configured, API authentication is disabled");
      http.authorizeHttpRequests(a -> a.anyRequest().permitAll());
      return http.build();
    }

    // Not a bean, so the servlet container does not register it a second time.
    BearerTokenFilter tokenFilter = new BearerTokenFilter(auth.getToken());
    http.authorizeHttpRequests(
            a ->
                a.dispatcherTypeMatchers(DispatcherType.ERROR)
                    .permitAll()
                    .requestMatchers(PUBLIC_PATHS)
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .addFilterBefore(tokenFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }
}
