/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.List;
import lombok.Builder;

/**
 * A {@code simpleType}, named or inline ({@code name == null}).
 */
@Builder(toBuilder = true)
public record SimpleTypeDef(
    String name,
    Variety variety,
    Restriction restriction,
    TypeName itemType,
    SimpleTypeDef inlineItemType,
    List<TypeName> memberTypes,
    List<SimpleTypeDef> inlineMemberTypes)
    implements SchemaNode {

  public SimpleTypeDef {
    variety = variety == null ? Variety.ATOMIC : variety;
    memberTypes = memberTypes == null ? List.of() : List.copyOf(memberTypes);
    inlineMemberTypes = inlineMemberTypes == null ? List.of() : List.copyOf(inlineMemberTypes);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SIMPLE_TYPE;
  }

  public enum Variety {
    ATOMIC,
    LIST,
    UNION
  }
}
