package com.example.auth.config;

import com.example.auth.service.TokenService;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
public class AuthSecurityConfig {

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(TokenService tokenService) {
    return new BearerTokenAuthenticationFilter(tokenService);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter)
      throws Exception {
    // セッションは OAuth の state 受け渡しにだけ使う。認証情報は常に Bearer トークン。
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
        .logout(logout -> logout.disable())
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers(
                        HttpMethod.POST,
                        "/auth/register",
                        "/auth/login",
                        "/auth/logout",
                        "/auth/refresh")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/auth/oauth/**")
                    .permitAll()
                    .requestMatchers("/auth/me")
                    .authenticated()
                    .anyRequest()
                    .authenticated())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint()));
    return http.build();
  }

  @Bean
  AuthenticationEntryPoint authenticationEntryPoint() {
    return (request, response, exception) -> {
      response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
    };
  }
}
