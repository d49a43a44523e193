package com.scholary.videogen.provider;

/** Provider-side upload handshake for externally hosted input media. */
public interface InputStager {

  /** True when the reference already points into the provider's own storage. */
  boolean isNativeReference(String url);

  /**
   * Upload the media behind {@code sourceUrl} and return the provider reference.
   *
   * @throws ProviderCallException of kind {@code INPUT_STAGING} on any failure
   */
  String upload(String sourceUrl, String model);
}
