package com.scholary.videogen.provider;

/** Classification of a provider model that decides required fields and request shape. */
public enum ModelKind {
  TEXT_TO_VIDEO("text_to_video"),
  IMAGE_TO_VIDEO("image_to_video"),
  KEYFRAME_TO_VIDEO("keyframe_to_video"),
  REFERENCE_TO_VIDEO("reference_to_video");

  private final String value;

  ModelKind(String value) {
    this.value = value;
  }

  /** Wire name stored in normalized parameters as {@code model_type}. */
  public String value() {
    return value;
  }
}
