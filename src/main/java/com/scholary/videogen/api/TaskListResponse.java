package com.scholary.videogen.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** A page of tasks with links to the neighbouring pages, {@code null} at either end. */
public record TaskListResponse(
    long total,
    @JsonProperty("page_size") int pageSize,
    @JsonProperty("current_page") int currentPage,
    @JsonProperty("total_pages") int totalPages,
    String next,
    String previous,
    List<TaskListItem> tasks) {}
