package com.scholary.videogen.artifact;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds downloadable media files under the data root by file name.
 *
 * <p>Lookup order: {@code videos/{name}}, then each provider directory under {@code videos}, then
 * a recursive search of the whole data root. Names containing path separators or {@code ..} are
 * rejected.
 */
@Component
public class MediaFileLocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaFileLocator.class);

  static final List<String> PROVIDER_DIRS = List.of("aliyun", "zhipuai");

  private static final Map<String, String> CONTENT_TYPES =
      Map.ofEntries(
          Map.entry("mp4", "video/mp4"),
          Map.entry("webm", "video/webm"),
          Map.entry("mov", "video/quicktime"),
          Map.entry("avi", "video/x-msvideo"),
          Map.entry("mkv", "video/x-matroska"),
          Map.entry("flv", "video/x-flv"),
          Map.entry("jpg", "image/jpeg"),
          Map.entry("jpeg", "image/jpeg"),
          Map.entry("png", "image/png"),
          Map.entry("gif", "image/gif"));

  private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private final Path dataDir;

  public MediaFileLocator(ArtifactResolver artifactResolver) {
    this.dataDir = artifactResolver.dataDir();
  }

  public Optional<Path> locate(String fileName) {
    if (!isPlainFileName(fileName)) {
      LOGGER.warn("Rejected download file name: {}", fileName);
      return Optional.empty();
    }

    Path videosDir = dataDir.resolve("videos");
    Path direct = videosDir.resolve(fileName);
    if (Files.isRegularFile(direct)) {
      return Optional.of(direct);
    }
    for (String provider : PROVIDER_DIRS) {
      Path candidate = videosDir.resolve(provider).resolve(fileName);
      if (Files.isRegularFile(candidate)) {
        return Optional.of(candidate);
      }
    }

    if (!Files.isDirectory(dataDir)) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.walk(dataDir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().equals(fileName))
          .findFirst();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to search " + dataDir + " for " + fileName, e);
    }
  }

  public static String contentType(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0) {
      return DEFAULT_CONTENT_TYPE;
    }
    String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    return CONTENT_TYPES.getOrDefault(extension, DEFAULT_CONTENT_TYPE);
  }

  private static boolean isPlainFileName(String fileName) {
    return fileName != null
        && !fileName.isBlank()
        && !fileName.contains("/")
        && !fileName.contains("\\")
        && !fileName.contains("..");
  }
}
