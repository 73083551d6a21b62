/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.model;

public enum NodeKind {
  ELEMENT,
  ATTRIBUTE,
  COMPLEX_TYPE,
  SIMPLE_TYPE,
  MODEL_GROUP,
  RESTRICTION
}
