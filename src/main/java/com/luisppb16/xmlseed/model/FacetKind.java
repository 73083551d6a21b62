/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Restriction facets the generator understands. Other facets are dropped at index time. */
@Getter
@RequiredArgsConstructor
public enum FacetKind {
  ENUMERATION("enumeration"),
  PATTERN("pattern"),
  LENGTH("length"),
  MIN_LENGTH("minLength"),
  MAX_LENGTH("maxLength"),
  MIN_INCLUSIVE("minInclusive"),
  MAX_INCLUSIVE("maxInclusive"),
  MIN_EXCLUSIVE("minExclusive"),
  MAX_EXCLUSIVE("maxExclusive");

  private final String localName;

  public static Optional<FacetKind> fromLocalName(final String localName) {
    return Arrays.stream(values()).filter(k -> k.localName.equals(localName)).findFirst();
  }
}
