package com.scholary.videogen.security;

import org.springframework.http.HttpMethod;

/** Permission required by one route: {@code resource:action}. */
public record RoutePermission(
    HttpMethod method, String pathPattern, String resource, String action) {

  @Override
  public String toString() {
    return method + " " + pathPattern + " -> " + resource + ":" + action;
  }
}
