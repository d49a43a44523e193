package com.scholary.videogen.provider;

/** Bad, missing or unsupported parameters. Never retried. */
public class ParameterValidationException extends RuntimeException {

  public ParameterValidationException(String message) {
    super(message);
  }
}
