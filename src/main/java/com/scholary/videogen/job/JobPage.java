package com.scholary.videogen.job;

import java.util.List;

/** One page of a job listing plus the total number of matching jobs. */
public record JobPage(List<Job> items, long total, int page, int pageSize) {

  public JobPage {
    items = List.copyOf(items);
  }

  /** Always at least one page, even when nothing matched. */
  public int totalPages() {
    if (total <= 0) {
      return 1;
    }
    return (int) ((total + pageSize - 1) / pageSize);
  }

  public boolean hasNext() {
    return page < totalPages();
  }

  public boolean hasPrevious() {
    return page > 1;
  }
}
