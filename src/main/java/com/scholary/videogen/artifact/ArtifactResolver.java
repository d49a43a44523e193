package com.scholary.videogen.artifact;

import com.scholary.videogen.config.VideoGenProperties;
import com.scholary.videogen.logging.StructuredLogger;
import com.scholary.videogen.provider.InputStager;
import com.scholary.videogen.provider.http.HttpProperties;
import com.scholary.videogen.provider.http.ProviderTransport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Materializes remote media locally and maps local files to servable URLs.
 *
 * <p>Two kinds of transfer go through here:
 *
 * <ul>
 *   <li>{@link #fetchToTemp} pulls input media into {@code {dataDir}/temp}, cached by source URL so
 *       repeated staging of the same image downloads it once per TTL.
 *   <li>{@link #download} saves generated output to a caller-chosen path and never throws.
 * </ul>
 *
 * <p>The temp area is swept at startup and then periodically: expired cache entries lose their
 * files, and untracked files older than the TTL are deleted.
 */
@Component
public class ArtifactResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactResolver.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);
  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final VideoGenProperties properties;
  private final ProviderTransport transport;
  private final HttpProperties httpProperties;
  private final Clock clock;
  private final Path dataDir;
  private final Path tempDir;
  private final Path videosDir;
  private final ArtifactCache cache;

  public ArtifactResolver(
      VideoGenProperties properties,
      ProviderTransport transport,
      HttpProperties httpProperties,
      Clock clock) {
    this.properties = properties;
    this.transport = transport;
    this.httpProperties = httpProperties;
    this.clock = clock;
    this.dataDir = Path.of(properties.dataDir()).toAbsolutePath().normalize();
    this.tempDir = dataDir.resolve("temp");
    this.videosDir = dataDir.resolve("videos");
    this.cache =
        new ArtifactCache(
            Duration.ofHours(properties.cache().ttlHours()), properties.cache().maxSize(), clock);

    try {
      Files.createDirectories(tempDir);
      Files.createDirectories(videosDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create data directories under " + dataDir, e);
    }

    LOGGER.info("Initialized artifact resolver: dataDir={}", dataDir);
  }

  public Path dataDir() {
    return dataDir;
  }

  public Path tempDir() {
    return tempDir;
  }

  /** Generated media root, the only directory served under the media path. */
  public Path videosDir() {
    return videosDir;
  }

  ArtifactCache cache() {
    return cache;
  }

  /**
   * Fetch remote input media into the temp area, reusing a live cached copy.
   *
   * <p>Two callers fetching the same URL at once both download; the later write wins the cache
   * slot.
   *
   * @throws ArtifactFetchException if the download fails
   */
  public Path fetchToTemp(String url) {
    return cache
        .get(url)
        .orElseGet(
            () -> {
              String fileName = UUID.randomUUID().toString().replace("-", "") + extensionOf(url);
              Path target = tempDir.resolve(fileName);
              try {
                long bytes =
                    transport.download(URI.create(url), target, httpProperties.transferTimeout());
                STRUCTURED_LOGGER.logArtifactDownloaded(url, target.toString(), bytes);
              } catch (RuntimeException e) {
                deleteIfExists(target);
                throw new ArtifactFetchException(
                    "Failed to fetch " + url + ": " + e.getMessage(), e);
              }
              cache.put(url, target, clock.instant());
              return target;
            });
  }

  /**
   * Download generated media to {@code destination}.
   *
   * @return the local path, or an empty string if the download failed
   */
  public String download(String remoteUrl, Path destination) {
    try {
      long bytes =
          transport.download(URI.create(remoteUrl), destination, httpProperties.transferTimeout());
      STRUCTURED_LOGGER.logArtifactDownloaded(remoteUrl, destination.toString(), bytes);
      return destination.toString();
    } catch (RuntimeException e) {
      LOGGER.error("Error downloading {}: {}", remoteUrl, e.getMessage());
      deleteIfExists(destination);
      return "";
    }
  }

  /**
   * Path for a new output file: {@code {dataDir}/videos/{provider}/{provider}_{ts}_{index}_{rand}}.
   */
  public Path newArtifactPath(String provider, int index, String extension) {
    String timestamp = LocalDateTime.now(clock).format(FILE_TIMESTAMP);
    String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    String fileName = String.format("%s_%s_%d_%s%s", provider, timestamp, index, random, extension);
    return videosDir.resolve(provider).resolve(fileName);
  }

  /**
   * Make sure input media lives in the provider's storage.
   *
   * @return {@code sourceUrl} unchanged if it is already a provider reference, otherwise the
   *     reference returned by the provider's upload
   */
  public String ensureStaged(String sourceUrl, String model, InputStager stager) {
    if (stager.isNativeReference(sourceUrl)) {
      return sourceUrl;
    }
    String reference = stager.upload(sourceUrl, model);
    STRUCTURED_LOGGER.logInputStaged(sourceUrl, reference);
    return reference;
  }

  /**
   * Map a local file to its servable URLs.
   *
   * <p>Files under the videos directory keep their path relative to it; anything else falls back
   * to its file name. Remote URLs are returned unchanged in all three slots.
   */
  public MediaUrls resolveDisplayUrls(String localPath) {
    if (localPath == null || localPath.isBlank()) {
      return MediaUrls.EMPTY;
    }
    if (isRemoteUrl(localPath)) {
      return new MediaUrls(localPath, localPath, localPath);
    }

    Path path = Path.of(localPath).toAbsolutePath().normalize();
    String fileName = path.getFileName().toString();
    String relative =
        path.startsWith(videosDir)
            ? videosDir.relativize(path).toString().replace('\\', '/')
            : fileName;

    String basePath = stripTrailingSlash(properties.media().basePath());
    String mediaPath = basePath + "/" + UriUtils.encodePath(relative, "UTF-8");
    String downloadUrl =
        stripTrailingSlash(properties.media().downloadBaseUrl())
            + "/"
            + UriUtils.encodePathSegment(fileName, "UTF-8");
    String publicBase = properties.media().publicBaseUrl();
    String absoluteUrl =
        publicBase == null || publicBase.isBlank()
            ? mediaPath
            : stripTrailingSlash(publicBase) + mediaPath;
    return new MediaUrls(mediaPath, downloadUrl, absoluteUrl);
  }

  /**
   * Reclaim expired cache entries and orphan temp files.
   *
   * @return number of orphan files deleted
   */
  @Scheduled(fixedDelayString = "${videogen.cache.sweepIntervalMillis:3600000}")
  public int sweep() {
    cache.cleanUp();
    Set<Path> tracked = cache.trackedPaths();
    Instant cutoff = clock.instant().minus(cache.ttl());
    int deleted = 0;

    try (DirectoryStream<Path> files = Files.newDirectoryStream(tempDir)) {
      for (Path file : files) {
        Path normalized = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized) || tracked.contains(normalized)) {
          continue;
        }
        if (Files.getLastModifiedTime(normalized).toInstant().isBefore(cutoff)) {
          Files.deleteIfExists(normalized);
          deleted++;
          LOGGER.info("Deleted orphan temp file: {}", normalized);
        }
      }
    } catch (IOException e) {
      LOGGER.warn("Temp sweep of {} failed: {}", tempDir, e.getMessage());
    }

    LOGGER.debug("Artifact sweep finished: orphansDeleted={}, {}", deleted, cache.getStats());
    return deleted;
  }

  static String extensionOf(String url) {
    String path = url;
    int query = path.indexOf('?');
    if (query >= 0) {
      path = path.substring(0, query);
    }
    int slash = path.lastIndexOf('/');
    String name = slash >= 0 ? path.substring(slash + 1) : path;
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return "";
    }
    return name.substring(dot).toLowerCase(Locale.ROOT);
  }

  private static boolean isRemoteUrl(String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }

  private static void deleteIfExists(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial file {}: {}", path, e.getMessage());
    }
  }
}
