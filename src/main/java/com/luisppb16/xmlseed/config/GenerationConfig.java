/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.config;

import java.util.Objects;
import lombok.Builder;

/**
 * Tunables of one generation run. Components left {@code null} fall back to their defaults, so a
 * partially filled builder or JSON file is always usable.
 *
 * @param unboundedMinOccurs lower end of the ceiling drawn for {@code maxOccurs="unbounded"}
 * @param unboundedMaxOccurs upper end of that ceiling
 * @param maxDepth element nesting depth past which generation aborts with an internal error
 * @param optionalAttributeProbability chance that an optional attribute is emitted
 * @param defaultStringMaxLength length cap for free text when no length facet applies
 * @param seed seed of the random source, {@code null} for an unseeded run
 */
@Builder(toBuilder = true)
public record GenerationConfig(
    Integer unboundedMinOccurs,
    Integer unboundedMaxOccurs,
    Integer maxDepth,
    Double optionalAttributeProbability,
    Integer defaultStringMaxLength,
    Long seed) {

  public static final int DEFAULT_UNBOUNDED_MIN_OCCURS = 2;
  public static final int DEFAULT_UNBOUNDED_MAX_OCCURS = 4;
  public static final int DEFAULT_MAX_DEPTH = 10;
  public static final double DEFAULT_OPTIONAL_ATTRIBUTE_PROBABILITY = 0.5;
  public static final int DEFAULT_STRING_MAX_LENGTH = 50;

  public GenerationConfig {
    unboundedMinOccurs = Objects.requireNonNullElse(unboundedMinOccurs, DEFAULT_UNBOUNDED_MIN_OCCURS);
    unboundedMaxOccurs = Objects.requireNonNullElse(unboundedMaxOccurs, DEFAULT_UNBOUNDED_MAX_OCCURS);
    maxDepth = Objects.requireNonNullElse(maxDepth, DEFAULT_MAX_DEPTH);
    optionalAttributeProbability =
        Objects.requireNonNullElse(
            optionalAttributeProbability, DEFAULT_OPTIONAL_ATTRIBUTE_PROBABILITY);
    defaultStringMaxLength =
        Objects.requireNonNullElse(defaultStringMaxLength, DEFAULT_STRING_MAX_LENGTH);

    if (unboundedMinOccurs < 0 || unboundedMaxOccurs < unboundedMinOccurs) {
      throw new IllegalArgumentException(
          "Unbounded occurrence ceiling must satisfy 0 <= min <= max, got [%d, %d]"
              .formatted(unboundedMinOccurs, unboundedMaxOccurs));
    }
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
    }
    if (optionalAttributeProbability < 0.0 || optionalAttributeProbability > 1.0) {
      throw new IllegalArgumentException(
          "optionalAttributeProbability must be within [0, 1], got "
              + optionalAttributeProbability);
    }
    if (defaultStringMaxLength < 1) {
      throw new IllegalArgumentException(
          "defaultStringMaxLength must be at least 1, got " + defaultStringMaxLength);
    }
  }

  public static GenerationConfig defaults() {
    return GenerationConfig.builder().build();
  }
}
