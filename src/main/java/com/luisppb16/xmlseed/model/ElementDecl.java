/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import lombok.Builder;

/**
 * An {@code element} declaration, global or local. Exactly one of {@code name} and {@code ref} is
 * expected; {@code type}, {@code inlineComplexType} and {@code inlineSimpleType} are all optional.
 *
 * @param qualified whether instances belong to the schema's target namespace
 */
@Builder(toBuilder = true)
public record ElementDecl(
    String name,
    String ref,
    TypeName type,
    ComplexTypeDef inlineComplexType,
    SimpleTypeDef inlineSimpleType,
    Occurrence occurrence,
    boolean global,
    boolean qualified,
    String fixedValue)
    implements Particle {

  public ElementDecl {
    if (name == null && ref == null) {
      throw new IllegalArgumentException("An element declaration needs a name or a ref.");
    }
    occurrence = occurrence == null ? Occurrence.ONCE : occurrence;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ELEMENT;
  }

  public boolean isReference() {
    return ref != null;
  }

  /** The tag an instance carries: its own name, or the referenced element's name. */
  public String displayName() {
    return name != null ? name : ref;
  }
}
