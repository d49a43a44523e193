package com.scholary.videogen.provider;

import com.scholary.videogen.job.JobErrorKind;

/**
 * Failure while driving a remote generation job.
 *
 * <p>The {@link Kind} tells callers which part failed: staging input media is retryable on its
 * own, a rejected request is not, and a timeout means the job may still be running remotely.
 */
public class ProviderCallException extends RuntimeException {

  public enum Kind {
    INPUT_STAGING(JobErrorKind.INPUT_STAGING),
    REMOTE_CALL(JobErrorKind.REMOTE_CALL),
    REMOTE_TIMEOUT(JobErrorKind.TIMEOUT);

    private final JobErrorKind errorKind;

    Kind(JobErrorKind errorKind) {
      this.errorKind = errorKind;
    }

    public JobErrorKind errorKind() {
      return errorKind;
    }
  }

  private final Kind kind;

  public ProviderCallException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ProviderCallException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
