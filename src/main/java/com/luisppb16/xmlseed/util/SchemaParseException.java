/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.util;

/** Thrown when the schema file is not well-formed XML. */
public class SchemaParseException extends XmlSeedException {

  public SchemaParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
