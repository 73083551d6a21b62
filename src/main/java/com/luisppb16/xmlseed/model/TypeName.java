/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

import java.util.Objects;

/**
 * A type reference as written in the schema ({@code raw}), with its local part and whether its
 * prefix resolved to the XML Schema namespace.
 *
 * @param raw the attribute value exactly as written, e.g. {@code xs:string}
 * @param localName the part after the prefix
 * @param builtin whether the prefix (or the default namespace) is bound to the XML Schema namespace
 */
public record TypeName(String raw, String localName, boolean builtin) {

  public TypeName {
    Objects.requireNonNull(localName, "Type local name cannot be null.");
    raw = raw == null ? localName : raw;
  }

  public static TypeName local(final String localName) {
    return new TypeName(localName, localName, false);
  }

  public static TypeName builtin(final String localName) {
    return new TypeName("xs:" + localName, localName, true);
  }

  /** Strips any prefix from a QName-valued attribute. */
  public static String localPart(final String qualifiedName) {
    if (qualifiedName == null) {
      return null;
    }
    final int colon = qualifiedName.indexOf(':');
    return colon >= 0 ? qualifiedName.substring(colon + 1).trim() : qualifiedName.trim();
  }
}
