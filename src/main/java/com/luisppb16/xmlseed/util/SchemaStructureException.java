/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.util;

/**
 * Thrown when a parsed document is not a usable XML Schema: wrong root element, missing schema
 * namespace, or no definitions at all.
 */
public class SchemaStructureException extends XmlSeedException {

  public SchemaStructureException(String message) {
    super(message);
  }
}
