package com.scholary.videogen.security;

import com.scholary.videogen.job.Job;

/**
 * Identity of the caller of a protected route, as established by the upstream identity gateway.
 *
 * @param tenantId tenant the caller acts for
 * @param userId user id, {@code null} for system-level keys
 * @param systemKey true for tenant/system-level credentials
 */
public record CallerContext(String tenantId, String userId, boolean systemKey) {

  /**
   * Request attribute under which the interceptor stores the caller. Must stay a constant
   * expression, controllers bind it with {@code @RequestAttribute}.
   */
  public static final String ATTRIBUTE = "com.scholary.videogen.security.CallerContext";

  public static CallerContext system(String tenantId) {
    return new CallerContext(tenantId, null, true);
  }

  /** User id recorded on jobs this caller creates. */
  public String ownerId() {
    return systemKey || userId == null ? Job.SYSTEM_USER : userId;
  }

  /** User filter for listings: system keys see the whole tenant. */
  public String listingUserId() {
    return systemKey ? null : userId;
  }
}
