/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.List;

/**
 * A {@code restriction} step. The base is either named ({@code base}) or declared inline
 * ({@code inlineBase}); facets keep document order.
 */
public record Restriction(TypeName base, SimpleTypeDef inlineBase, List<Facet> facets)
    implements SchemaNode {

  public Restriction {
    facets = facets == null ? List.of() : List.copyOf(facets);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.RESTRICTION;
  }
}
