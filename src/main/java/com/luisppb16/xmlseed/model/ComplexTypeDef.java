/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.List;
import lombok.Builder;

/**
 * A {@code complexType}, named or inline ({@code name == null}).
 *
 * @param groups the top-level model groups, including those nested in a
 *     {@code complexContent} derivation
 * @param contentBase base type of a {@code complexContent} extension or of {@code simpleContent}
 * @param simpleContentRestriction facets of a {@code simpleContent/restriction}, if any
 */
@Builder(toBuilder = true)
public record ComplexTypeDef(
    String name,
    List<AttributeDecl> attributes,
    List<ModelGroup> groups,
    Derivation derivation,
    TypeName contentBase,
    Restriction simpleContentRestriction)
    implements SchemaNode {

  public ComplexTypeDef {
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
    groups = groups == null ? List.of() : List.copyOf(groups);
    derivation = derivation == null ? Derivation.NONE : derivation;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.COMPLEX_TYPE;
  }

  public List<ModelGroup> groups(final GroupKind kind) {
    return groups.stream().filter(g -> g.groupKind() == kind).toList();
  }

  public enum Derivation {
    NONE,
    COMPLEX_EXTENSION,
    SIMPLE_CONTENT
  }
}
