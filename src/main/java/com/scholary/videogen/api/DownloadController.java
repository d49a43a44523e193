package com.scholary.videogen.api;

import com.scholary.videogen.artifact.MediaFileLocator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/** Streams generated media files by name. */
@RestController
@Tag(name = "Download", description = "Generated media download")
public class DownloadController {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadController.class);

  private final MediaFileLocator locator;

  public DownloadController(MediaFileLocator locator) {
    this.locator = locator;
  }

  @GetMapping("/api/download/{fileName:.+}")
  @Operation(
      summary = "Download file",
      description = "Look up a file under the data directory and stream it")
  public ResponseEntity<?> download(@PathVariable String fileName) {
    return locator
        .locate(fileName)
        .<ResponseEntity<?>>map(path -> fileResponse(fileName, path))
        .orElseGet(
            () -> {
              LOGGER.warn("File not found: {}", fileName);
              return ResponseEntity.status(404)
                  .body(ApiResponse.error("File not found: " + fileName, "NOT_FOUND"));
            });
  }

  private ResponseEntity<Resource> fileResponse(String fileName, Path path) {
    LOGGER.info("Serving file download: {}", path);
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(MediaFileLocator.contentType(fileName)))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(fileName).build().toString())
        .body(new FileSystemResource(path));
  }
}
