package com.scholary.videogen.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderRegistryTest {

  private static ProviderAdapter adapter(String name, String... models) {
    return new ProviderAdapter() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public List<String> supportedModels() {
        return List.of(models);
      }

      @Override
      public ObjectNode validateParameters(String model, JsonNode parameters) {
        throw new UnsupportedOperationException();
      }

      @Override
      public CanonicalResult call(String model, JsonNode parameters) {
        throw new UnsupportedOperationException();
      }
    };
  }

  @Test
  void looksUpByExactName() {
    ProviderAdapter aliyun = adapter("aliyun", "m1");
    ProviderRegistry registry =
        ProviderRegistry.builder()
            .register(aliyun)
            .register(adapter("zhipuai", "m2"))
            .defaultProvider("aliyun")
            .build();

    assertThat(registry.get("aliyun")).isSameAs(aliyun);
    assertThat(registry.getDefault()).isSameAs(aliyun);
    assertThat(registry.listAll()).containsOnlyKeys("aliyun", "zhipuai");
    assertThatThrownBy(() -> registry.get("Aliyun"))
        .isInstanceOf(ProviderNotFoundException.class);
  }

  @Test
  void unknownProviderListsTheAvailableOnes() {
    ProviderRegistry registry =
        ProviderRegistry.builder()
            .register(adapter("aliyun"))
            .register(adapter("zhipuai"))
            .build();

    assertThatThrownBy(() -> registry.get("openai"))
        .isInstanceOf(ProviderNotFoundException.class)
        .hasMessage("Provider 'openai' not found. Available providers: aliyun, zhipuai")
        .satisfies(
            e ->
                assertThat(((ProviderNotFoundException) e).getAvailable())
                    .containsExactly("aliyun", "zhipuai"));
  }

  @Test
  void laterRegistrationReplacesEarlier() {
    ProviderAdapter replacement = adapter("aliyun", "m9");
    ProviderRegistry registry =
        ProviderRegistry.builder().register(adapter("aliyun", "m1")).register(replacement).build();

    assertThat(registry.get("aliyun")).isSameAs(replacement);
    assertThat(registry.supportedModels()).containsEntry("aliyun", List.of("m9"));
  }

  @Test
  void groupsModelsInRegistrationOrder() {
    ProviderRegistry registry =
        ProviderRegistry.builder()
            .register(adapter("zhipuai", "cogvideox-2"))
            .register(adapter("aliyun", "wanx2.1-t2v-turbo", "wanx2.1-t2v-plus"))
            .build();

    assertThat(registry.supportedModels().keySet()).containsExactly("zhipuai", "aliyun");
    assertThat(registry.supportedModels().get("aliyun"))
        .containsExactly("wanx2.1-t2v-turbo", "wanx2.1-t2v-plus");
  }

  @Test
  void parsesConfiguredModelLists() {
    List<String> fallback = List.of("a", "b");

    assertThat(SupportedModels.parse(null, fallback)).isEqualTo(fallback);
    assertThat(SupportedModels.parse("  ", fallback)).isEqualTo(fallback);
    assertThat(SupportedModels.parse(" x , y,,x ", fallback)).containsExactly("x", "y");
    assertThat(SupportedModels.parse(",", fallback)).isEqualTo(fallback);
  }
}
