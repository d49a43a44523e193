package com.scholary.videogen.api;

import com.scholary.videogen.config.VideoGenProperties;
import com.scholary.videogen.job.Job;
import com.scholary.videogen.job.JobPage;
import com.scholary.videogen.job.JobQuery;
import com.scholary.videogen.job.JobSort;
import com.scholary.videogen.job.JobStatus;
import com.scholary.videogen.security.CallerContext;
import com.scholary.videogen.service.TaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * REST API for video generation tasks.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Creating a task (asynchronous by default, returns the task id immediately)
 *   <li>Polling task status and fetching the result
 *   <li>Cancelling a pending or running task
 *   <li>Listing the caller's tasks, or the whole tenant's for system keys
 * </ul>
 */
@RestController
@RequestMapping("/api/tasks")
@Tag(name = "Tasks", description = "Video generation task API")
public class TaskController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskController.class);

  private final TaskService taskService;
  private final VideoGenProperties properties;

  public TaskController(TaskService taskService, VideoGenProperties properties) {
    this.taskService = taskService;
    this.properties = properties;
  }

  @PostMapping
  @Operation(
      summary = "Create task",
      description = "Validate parameters, persist a pending task and start it")
  public ResponseEntity<ApiResponse<TaskCreatedResponse>> createTask(
      @RequestBody CreateTaskRequest request,
      @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller) {
    String model = request.model() == null ? properties.defaultModel() : request.model();
    LOGGER.info(
        "Create task request: tenant={}, user={}, provider={}, model={}, async={}",
        caller.tenantId(),
        caller.ownerId(),
        request.provider(),
        model,
        request.async());

    String taskId =
        taskService.createTask(
            caller.tenantId(),
            caller.ownerId(),
            request.provider(),
            model,
            request.parameters(),
            request.async());

    HttpStatus status = request.async() ? HttpStatus.ACCEPTED : HttpStatus.OK;
    return ResponseEntity.status(status)
        .body(ApiResponse.ok("Task created", new TaskCreatedResponse(taskId)));
  }

  @GetMapping("/{taskId}/status")
  @Operation(summary = "Get task status", description = "Lifecycle status and timestamps")
  public ApiResponse<TaskStatusResponse> getTaskStatus(@PathVariable String taskId) {
    return ApiResponse.ok(
        "Task status retrieved", TaskStatusResponse.from(taskService.getTaskStatus(taskId)));
  }

  @GetMapping("/{taskId}/result")
  @Operation(
      summary = "Get task result",
      description = "Result with media URLs when completed, error text when failed")
  public ApiResponse<TaskResultResponse> getTaskResult(@PathVariable String taskId) {
    return ApiResponse.ok(
        "Task result retrieved", TaskResultResponse.from(taskService.getTaskResult(taskId)));
  }

  @PostMapping("/{taskId}/cancel")
  @Operation(
      summary = "Cancel task",
      description = "Mark a pending or running task cancelled; remote work is not stopped")
  public ResponseEntity<ApiResponse<TaskCreatedResponse>> cancelTask(@PathVariable String taskId) {
    if (!taskService.cancelTask(taskId)) {
      return ResponseEntity.badRequest()
          .body(
              ApiResponse.error(
                  "Failed to cancel task with ID "
                      + taskId
                      + ": task does not exist or is already cancelled/completed",
                  "CANCEL_REJECTED"));
    }
    return ResponseEntity.ok(ApiResponse.ok("Task cancelled", new TaskCreatedResponse(taskId)));
  }

  @GetMapping
  @Operation(summary = "List tasks", description = "Filtered, ordered and paginated task listing")
  public ApiResponse<TaskListResponse> listTasks(
      @Parameter(description = "pending, running, completed, failed or cancelled")
          @RequestParam(required = false)
          String status,
      @RequestParam(required = false) String model,
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "10") int pageSize,
      @Parameter(description = "Sort field, '-' prefix for descending")
          @RequestParam(defaultValue = JobSort.DEFAULT)
          String ordering,
      @RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
      HttpServletRequest servletRequest) {
    JobQuery query =
        new JobQuery(
            caller.tenantId(),
            caller.listingUserId(),
            status == null || status.isBlank() ? null : JobStatus.fromValue(status),
            model == null || model.isBlank() ? null : model,
            page,
            pageSize,
            JobSort.parse(ordering));
    JobPage result = taskService.listTasks(query);

    Function<Job, TaskListItem> toItem =
        caller.systemKey() ? TaskListItem::forTenant : TaskListItem::forUser;
    List<TaskListItem> items = result.items().stream().map(toItem).toList();

    String baseUrl = servletRequest.getRequestURL().toString();
    TaskListResponse response =
        new TaskListResponse(
            result.total(),
            pageSize,
            page,
            result.totalPages(),
            result.hasNext()
                ? pageLink(baseUrl, status, model, pageSize, ordering, page + 1)
                : null,
            result.hasPrevious()
                ? pageLink(baseUrl, status, model, pageSize, ordering, page - 1)
                : null,
            items);
    return ApiResponse.ok("Task list retrieved", response);
  }

  private static String pageLink(
      String baseUrl, String status, String model, int pageSize, String ordering, int page) {
    UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl);
    if (status != null && !status.isBlank()) {
      builder.queryParam("status", status);
    }
    if (model != null && !model.isBlank()) {
      builder.queryParam("model", model);
    }
    return builder
        .queryParam("page_size", pageSize)
        .queryParam("ordering", ordering)
        .queryParam("page", page)
        .encode()
        .toUriString();
  }
}
