package com.scholary.videogen.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup from provider name to adapter.
 *
 * <p>Built once at startup through {@link Builder}; afterwards it is only read, so concurrent
 * access needs no locking.
 */
public final class ProviderRegistry {

  private final Map<String, ProviderAdapter> adapters;
  private final String defaultProvider;

  private ProviderRegistry(Map<String, ProviderAdapter> adapters, String defaultProvider) {
    this.adapters = Collections.unmodifiableMap(new LinkedHashMap<>(adapters));
    this.defaultProvider = defaultProvider;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @throws ProviderNotFoundException if nothing is registered under {@code name}
   */
  public ProviderAdapter get(String name) {
    ProviderAdapter adapter = name == null ? null : adapters.get(name);
    if (adapter == null) {
      throw new ProviderNotFoundException(name, new ArrayList<>(adapters.keySet()));
    }
    return adapter;
  }

  public ProviderAdapter getDefault() {
    return get(defaultProvider);
  }

  public String defaultProviderName() {
    return defaultProvider;
  }

  /** Adapters in registration order. */
  public Map<String, ProviderAdapter> listAll() {
    return adapters;
  }

  /** Supported models grouped by provider, in registration order. */
  public Map<String, List<String>> supportedModels() {
    Map<String, List<String>> models = new LinkedHashMap<>();
    adapters.forEach((name, adapter) -> models.put(name, adapter.supportedModels()));
    return Collections.unmodifiableMap(models);
  }

  public static final class Builder {

    private final Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();
    private String defaultProvider;

    private Builder() {}

    /** Register an adapter. A later registration under the same name replaces the earlier one. */
    public Builder register(ProviderAdapter adapter) {
      adapters.put(adapter.name(), adapter);
      return this;
    }

    public Builder defaultProvider(String name) {
      this.defaultProvider = name;
      return this;
    }

    public ProviderRegistry build() {
      return new ProviderRegistry(adapters, defaultProvider);
    }
  }
}
