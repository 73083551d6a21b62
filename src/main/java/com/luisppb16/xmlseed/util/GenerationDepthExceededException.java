/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.util;

/**
 * Internal error: the generator nested deeper than its configured limit. The cycle check runs
 * before generation, so this means the check and the live traversal disagree about the graph.
 */
public class GenerationDepthExceededException extends XmlSeedException {

  public GenerationDepthExceededException(String message) {
    super(message);
  }
}
