/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.List;
import lombok.Builder;

/**
 * Value-space restrictions collected from one schema node. Every field is optional; absence means
 * no restriction of that kind. Numeric bounds are kept as written.
 */
@Builder(toBuilder = true)
public record ValueConstraint(
    List<String> enumeration,
    String pattern,
    Integer length,
    Integer minLength,
    Integer maxLength,
    String minInclusive,
    String maxInclusive,
    String minExclusive,
    String maxExclusive) {

  private static final ValueConstraint EMPTY = ValueConstraint.builder().build();

  public ValueConstraint {
    enumeration = enumeration == null ? List.of() : List.copyOf(enumeration);
    if (!enumeration.isEmpty()) {
      pattern = null;
    }
  }

  public static ValueConstraint empty() {
    return EMPTY;
  }

  public boolean hasEnumeration() {
    return !enumeration.isEmpty();
  }

  public boolean hasPattern() {
    return pattern != null && !pattern.isBlank();
  }

  /**
   * Returns a copy where every field set on {@code override} replaces this one's. An enumeration on
   * either side still wins over a pattern.
   */
  public ValueConstraint overlaidBy(final ValueConstraint override) {
    if (override == null || override.equals(EMPTY)) {
      return this;
    }
    return new ValueConstraint(
        override.hasEnumeration() ? override.enumeration : enumeration,
        override.pattern != null ? override.pattern : pattern,
        override.length != null ? override.length : length,
        override.minLength != null ? override.minLength : minLength,
        override.maxLength != null ? override.maxLength : maxLength,
        override.minInclusive != null ? override.minInclusive : minInclusive,
        override.maxInclusive != null ? override.maxInclusive : maxInclusive,
        override.minExclusive != null ? override.minExclusive : minExclusive,
        override.maxExclusive != null ? override.maxExclusive : maxExclusive);
  }
}
