/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.registry;

import java.util.Objects;

/**
 * A built-in schema type and the value-space limits it imposes on its family.
 *
 * @param min lowest legal integer value, {@code null} when unlimited
 * @param max highest legal integer value, {@code null} when unlimited
 */
public record BuiltinType(ValueFamily family, Long min, Long max) {

  public BuiltinType {
    Objects.requireNonNull(family, "Built-in type family cannot be null.");
  }
}
