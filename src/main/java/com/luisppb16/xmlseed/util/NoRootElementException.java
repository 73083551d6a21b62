/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.util;

public class NoRootElementException extends XmlSeedException {

  public NoRootElementException(String message) {
    super(message);
  }
}
