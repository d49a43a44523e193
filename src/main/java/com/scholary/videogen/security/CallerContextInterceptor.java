package com.scholary.videogen.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videogen.api.ApiResponse;
import com.scholary.videogen.config.VideoGenProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Establishes the caller of protected routes.
 *
 * <p>Token and key verification happen in the identity gateway in front of this service, which
 * forwards the verified identity as {@code X-Tenant-Id}, {@code X-User-Id} and {@code X-Key-Type}
 * headers. A protected request without a tenant, or a user-level request without a user, is
 * answered with 401. With authentication disabled every caller is a system caller of the default
 * tenant.
 */
public class CallerContextInterceptor implements HandlerInterceptor {

  private static final Logger LOGGER = LoggerFactory.getLogger(CallerContextInterceptor.class);

  static final String TENANT_HEADER = "X-Tenant-Id";
  static final String USER_HEADER = "X-User-Id";
  static final String KEY_TYPE_HEADER = "X-Key-Type";
  static final String SYSTEM_KEY_TYPE = "system";

  private final RoutePermissionTable permissions;
  private final VideoGenProperties.AuthProperties auth;
  private final ObjectMapper objectMapper;

  public CallerContextInterceptor(
      RoutePermissionTable permissions,
      VideoGenProperties.AuthProperties auth,
      ObjectMapper objectMapper) {
    this.permissions = permissions;
    this.auth = auth;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
      throws IOException {
    Optional<RoutePermission> permission =
        permissions.match(request.getMethod(), request.getRequestURI());
    if (permission.isEmpty()) {
      return true;
    }

    if (!auth.enabled()) {
      request.setAttribute(CallerContext.ATTRIBUTE, CallerContext.system(auth.defaultTenant()));
      return true;
    }

    String tenantId = header(request, TENANT_HEADER);
    String userId = header(request, USER_HEADER);
    boolean systemKey = SYSTEM_KEY_TYPE.equalsIgnoreCase(header(request, KEY_TYPE_HEADER));

    if (tenantId == null) {
      return reject(response, permission.get(), "Missing tenant identity");
    }
    if (!systemKey && userId == null) {
      return reject(response, permission.get(), "Missing user identity");
    }

    LOGGER.debug(
        "Caller tenant={}, user={}, system={} granted {}",
        tenantId,
        userId,
        systemKey,
        permission.get());
    request.setAttribute(CallerContext.ATTRIBUTE, new CallerContext(tenantId, userId, systemKey));
    return true;
  }

  private boolean reject(HttpServletResponse response, RoutePermission permission, String reason)
      throws IOException {
    LOGGER.warn("Authentication failed for {}: {}", permission, reason);
    response.setStatus(HttpStatus.UNAUTHORIZED.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(
        response.getOutputStream(), ApiResponse.error(reason, "UNAUTHORIZED"));
    return false;
  }

  private static String header(HttpServletRequest request, String name) {
    String value = request.getHeader(name);
    return value == null || value.isBlank() ? null : value.trim();
  }
}
