/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml;

import com.luisppb16.xmlseed.schema.SchemaIndex;
import com.luisppb16.xmlseed.xml.CycleDetector.CycleCheckResult;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A loaded schema that passed the cycle check. Read-only, so one session can serve concurrent
 * generation calls.
 *
 * @param source the schema file, {@code null} when loaded from a string
 */
public record XmlSchemaSession(SchemaIndex index, CycleCheckResult cycleCheck, Path source) {

  public XmlSchemaSession {
    Objects.requireNonNull(index, "Schema index cannot be null.");
    Objects.requireNonNull(cycleCheck, "Cycle check result cannot be null.");
    cycleCheck.orThrow();
  }
}
