/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.schema;

import org.dom4j.Element;

/** Schema languages recognised from a document's root element. */
public enum SchemaFormat {
  XSD,
  RELAX_NG,
  UNKNOWN;

  public static final String XSD_NAMESPACE = "http://www.w3.org/2001/XMLSchema";
  public static final String RELAX_NG_NAMESPACE = "http://relaxng.org/ns/structure/1.0";

  public static SchemaFormat detect(final Element root) {
    if (root == null) {
      return UNKNOWN;
    }
    final String namespace = root.getNamespaceURI();
    final String localName = root.getName();
    if (XSD_NAMESPACE.equals(namespace) && "schema".equals(localName)) {
      return XSD;
    }
    if (RELAX_NG_NAMESPACE.equals(namespace)
        && ("grammar".equals(localName) || "element".equals(localName))) {
      return RELAX_NG;
    }
    return UNKNOWN;
  }
}
