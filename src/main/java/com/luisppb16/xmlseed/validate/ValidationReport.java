/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.validate;

import java.util.List;

/**
 * Messages collected while validating one document, each prefixed with its line number.
 *
 * @param violations errors and fatal errors; the document is valid when this is empty
 * @param warnings validator warnings, reported but not failing
 */
public record ValidationReport(List<String> violations, List<String> warnings) {

  public ValidationReport {
    violations = violations == null ? List.of() : List.copyOf(violations);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public boolean isValid() {
    return violations.isEmpty();
  }
}
