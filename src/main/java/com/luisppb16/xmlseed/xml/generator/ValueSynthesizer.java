/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml.generator;

/**
 * Source of realistic literal text. {@link ValueResolver} decides which kind of value and which
 * bounds apply; implementations only produce the literal.
 */
public interface ValueSynthesizer {

  /** A single word, never empty. */
  String word();

  /** Free text of at most {@code maxChars} characters, never empty. */
  String sentence(int maxChars);

  /** An {@code xs:date} literal, e.g. {@code 2024-03-17}. */
  String date();

  /** An {@code xs:dateTime} literal without zone, e.g. {@code 2024-03-17T08:15:00}. */
  String dateTime();

  /** An {@code xs:time} literal, e.g. {@code 08:15:00}. */
  String time();

  String url();
}
