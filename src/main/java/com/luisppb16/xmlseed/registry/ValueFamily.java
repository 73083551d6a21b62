/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.registry;

/** Generation strategy shared by a group of built-in types. */
public enum ValueFamily {
  STRING,
  NAME,
  LANGUAGE,
  INTEGER,
  DECIMAL,
  BOOLEAN,
  DATE,
  DATE_TIME,
  TIME,
  URI
}
