package io.intellixity.discover.server.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Takes the authenticated member identity from {@value #MEMBER_HEADER} and exposes it as the request
 * attribute {@value #MEMBER_ATTRIBUTE}. Authentication itself happens upstream.
 */
@Component
public final class MemberContextFilter extends OncePerRequestFilter {
  public static final String MEMBER_HEADER = "X-Discover-User";
  public static final String MEMBER_ATTRIBUTE = "discover.member";

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path == null || !path.startsWith("/api/");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String member = request.getHeader(MEMBER_HEADER);
    if (member == null || member.isBlank()) {
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing required header: " + MEMBER_HEADER);
      return;
    }
    request.setAttribute(MEMBER_ATTRIBUTE, member.trim());
    filterChain.doFilter(request, response);
  }
}
