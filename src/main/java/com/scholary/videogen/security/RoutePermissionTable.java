package com.scholary.videogen.security;

import java.util.List;
import java.util.Optional;
import org.springframework.http.HttpMethod;
import org.springframework.util.AntPathMatcher;

/**
 * Declarative table of protected routes.
 *
 * <p>Built once at startup. The first entry whose method and Ant-style pattern match a request
 * decides the permission; requests matching no entry are public.
 */
public final class RoutePermissionTable {

  private static final AntPathMatcher PATH_MATCHER = new AntPathMatcher();

  private final List<RoutePermission> entries;

  public RoutePermissionTable(List<RoutePermission> entries) {
    this.entries = List.copyOf(entries);
  }

  /** Permissions of the task API. Model listing, downloads and health stay public. */
  public static RoutePermissionTable defaults() {
    return new RoutePermissionTable(
        List.of(
            new RoutePermission(HttpMethod.POST, "/api/tasks", "tasks", "create"),
            new RoutePermission(HttpMethod.GET, "/api/tasks", "tasks", "list"),
            new RoutePermission(HttpMethod.GET, "/api/tasks/*/status", "tasks", "read"),
            new RoutePermission(HttpMethod.GET, "/api/tasks/*/result", "tasks", "read"),
            new RoutePermission(HttpMethod.POST, "/api/tasks/*/cancel", "tasks", "cancel")));
  }

  public Optional<RoutePermission> match(String method, String path) {
    String normalized =
        path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    return entries.stream()
        .filter(entry -> entry.method().matches(method))
        .filter(entry -> PATH_MATCHER.match(entry.pathPattern(), normalized))
        .findFirst();
  }

  public List<RoutePermission> entries() {
    return entries;
  }
}
