package com.scholary.videogen.provider;

import java.util.List;

/** No adapter is registered under the requested name. */
public class ProviderNotFoundException extends RuntimeException {

  private final String name;
  private final List<String> available;

  public ProviderNotFoundException(String name, List<String> available) {
    super(
        String.format(
            "Provider '%s' not found. Available providers: %s",
            name, String.join(", ", available)));
    this.name = name;
    this.available = List.copyOf(available);
  }

  public String getName() {
    return name;
  }

  public List<String> getAvailable() {
    return available;
  }
}
