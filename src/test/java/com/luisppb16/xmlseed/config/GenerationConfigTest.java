/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class GenerationConfigTest {

  @Test
  void defaultsFillEveryComponent() {
    final GenerationConfig config = GenerationConfig.defaults();

    assertThat(config.unboundedMinOccurs()).isEqualTo(2);
    assertThat(config.unboundedMaxOccurs()).isEqualTo(4);
    assertThat(config.maxDepth()).isEqualTo(10);
    assertThat(config.optionalAttributeProbability()).isEqualTo(0.5);
    assertThat(config.defaultStringMaxLength()).isEqualTo(50);
    assertThat(config.seed()).isNull();
  }

  @Test
  void partialBuilderKeepsOtherDefaults() {
    final GenerationConfig config = GenerationConfig.builder().maxDepth(3).seed(5L).build();

    assertThat(config.maxDepth()).isEqualTo(3);
    assertThat(config.seed()).isEqualTo(5L);
    assertThat(config.unboundedMaxOccurs()).isEqualTo(4);
  }

  @Test
  void rejectsInvertedCeiling() {
    assertThatThrownBy(
            () -> GenerationConfig.builder().unboundedMinOccurs(5).unboundedMaxOccurs(2).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("[5, 2]");
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThatThrownBy(() -> GenerationConfig.builder().maxDepth(0).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("maxDepth");
    assertThatThrownBy(() -> GenerationConfig.builder().optionalAttributeProbability(1.5).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("optionalAttributeProbability");
    assertThatThrownBy(() -> GenerationConfig.builder().defaultStringMaxLength(0).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("defaultStringMaxLength");
  }
}
