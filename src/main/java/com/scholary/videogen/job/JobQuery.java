package com.scholary.videogen.job;

/**
 * Filter and page selection for job listings.
 *
 * <p>A null {@code userId} lists the whole tenant, which is what system-level credentials get.
 * Pagination is offset based: {@code skip = (page - 1) * pageSize}.
 */
public record JobQuery(
    String tenantId,
    String userId,
    JobStatus status,
    String model,
    int page,
    int pageSize,
    JobSort sort) {

  public static final int MAX_PAGE_SIZE = 100;

  public JobQuery {
    if (page < 1) {
      throw new IllegalArgumentException("page must be >= 1");
    }
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("page_size must be between 1 and " + MAX_PAGE_SIZE);
    }
    if (sort == null) {
      sort = JobSort.parse(JobSort.DEFAULT);
    }
  }

  public int skip() {
    return (page - 1) * pageSize;
  }

  public int limit() {
    return pageSize;
  }

  public boolean tenantWide() {
    return userId == null;
  }
}
