/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum GroupKind {
  SEQUENCE("sequence"),
  CHOICE("choice"),
  ALL("all");

  private final String localName;

  public static Optional<GroupKind> fromLocalName(final String localName) {
    return Arrays.stream(values()).filter(k -> k.localName.equals(localName)).findFirst();
  }
}
