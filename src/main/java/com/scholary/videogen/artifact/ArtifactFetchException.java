package com.scholary.videogen.artifact;

/** Remote media could not be fetched into local storage. */
public class ArtifactFetchException extends RuntimeException {

  public ArtifactFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
