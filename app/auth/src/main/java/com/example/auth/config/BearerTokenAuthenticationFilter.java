package com.example.auth.config;

import com.example.auth.model.AuthenticatedUser;
import com.example.auth.service.AuthException;
import com.example.auth.service.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests that carry {@code Authorization: Bearer <token>}.
 *
 * <p>A missing or failing token leaves the security context empty. Protected routes are then
 * rejected by the entry point, public ones proceed anonymously.
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String USER_ROLE = "ROLE_USER";

  private final TokenService tokenService;

  public BearerTokenAuthenticationFilter(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  /** Returns the token of a Bearer authorization header, or null for any other shape. */
  public static String extractToken(String authorizationHeader) {
    if (authorizationHeader == null
        || authorizationHeader.length() <= BEARER_PREFIX.length()
        || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    final String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (token != null) {
      try {
        final long identityId = tokenService.verify(token);
        final UsernamePasswordAuthenticationToken authentication =
            new UsernamePasswordAuthenticationToken(
                new AuthenticatedUser(identityId),
                "N/A",
                List.of(new SimpleGrantedAuthority(USER_ROLE)));
        SecurityContextHolder.getContext().setAuthentication(authentication);
      } catch (AuthException ex) {
        logger.debug(
            "bearer token rejected reason={} path={}", ex.reason(), request.getRequestURI());
      }
    }
    filterChain.doFilter(request, response);
  }
}
