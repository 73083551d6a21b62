/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.util;

/** Base type of every fatal error raised while loading a schema or generating a document. */
public class XmlSeedException extends RuntimeException {

  public XmlSeedException(String message) {
    super(message);
  }

  public XmlSeedException(String message, Throwable cause) {
    super(message, cause);
  }
}
