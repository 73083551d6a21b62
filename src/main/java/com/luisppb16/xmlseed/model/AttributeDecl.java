/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import lombok.Builder;

@Builder(toBuilder = true)
public record AttributeDecl(
    String name,
    String ref,
    TypeName type,
    SimpleTypeDef inlineSimpleType,
    AttributeUse use,
    String fixedValue,
    String defaultValue,
    boolean global)
    implements SchemaNode {

  public AttributeDecl {
    if (name == null && ref == null) {
      throw new IllegalArgumentException("An attribute declaration needs a name or a ref.");
    }
    use = use == null ? AttributeUse.OPTIONAL : use;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ATTRIBUTE;
  }

  public String displayName() {
    return name != null ? name : TypeName.localPart(ref);
  }
}
