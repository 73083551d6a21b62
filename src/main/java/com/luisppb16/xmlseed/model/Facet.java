/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.Objects;

public record Facet(FacetKind kind, String value) {

  public Facet {
    Objects.requireNonNull(kind, "Facet kind cannot be null.");
    value = value == null ? "" : value;
  }
}
