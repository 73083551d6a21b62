/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.Locale;

public enum AttributeUse {
  REQUIRED,
  OPTIONAL,
  PROHIBITED;

  /** Maps the {@code use} attribute value; anything absent or unrecognised is optional. */
  public static AttributeUse parse(final String value) {
    if (value == null) {
      return OPTIONAL;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "required" -> REQUIRED;
      case "prohibited" -> PROHIBITED;
      default -> OPTIONAL;
    };
  }
}
