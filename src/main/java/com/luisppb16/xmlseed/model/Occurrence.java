/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

/**
 * Occurrence bounds of a particle.
 *
 * @param min {@code minOccurs}, never negative
 * @param max {@code maxOccurs}, or {@code null} for {@code unbounded}
 */
public record Occurrence(int min, Integer max) {

  public static final Occurrence ONCE = new Occurrence(1, 1);

  public Occurrence {
    if (min < 0) {
      throw new IllegalArgumentException("minOccurs cannot be negative: " + min);
    }
    if (max != null && max < 0) {
      throw new IllegalArgumentException("maxOccurs cannot be negative: " + max);
    }
  }

  public static Occurrence unbounded(final int min) {
    return new Occurrence(min, null);
  }

  public boolean isUnbounded() {
    return max == null;
  }
}
