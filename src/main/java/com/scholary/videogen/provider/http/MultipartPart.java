package com.scholary.videogen.provider.http;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** One part of a multipart/form-data body. {@code filename} is null for plain fields. */
public record MultipartPart(String name, String filename, String contentType, byte[] content) {

  public static MultipartPart field(String name, String value) {
    return new MultipartPart(name, null, null, value.getBytes(StandardCharsets.UTF_8));
  }

  public static MultipartPart file(String name, Path file, String contentType) {
    try {
      return new MultipartPart(
          name, file.getFileName().toString(), contentType, Files.readAllBytes(file));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + file, e);
    }
  }

  public boolean isFile() {
    return filename != null;
  }
}
