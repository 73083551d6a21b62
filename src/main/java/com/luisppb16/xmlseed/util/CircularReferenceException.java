/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.util;

import java.util.List;

/** Thrown when a definition can reach itself through the schema's reference graph. */
public class CircularReferenceException extends XmlSeedException {

  private final List<String> path;

  public CircularReferenceException(List<String> path) {
    super("Circular reference detected: " + String.join(" -> ", path));
    this.path = List.copyOf(path);
  }

  /** Identities from the start node to the repeated one, e.g. {@code element:Node}. */
  public List<String> getPath() {
    return path;
  }
}
