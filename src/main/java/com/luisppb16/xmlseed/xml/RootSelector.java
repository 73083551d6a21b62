/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml;

import com.luisppb16.xmlseed.model.ElementDecl;
import com.luisppb16.xmlseed.schema.SchemaIndex;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the element to instantiate as document root when the caller names none.
 *
 * <p>Preference, first match wins: a global, unreferenced element with complex content; any
 * global unreferenced element; any unreferenced element; the first element in document order.
 */
@Slf4j
@UtilityClass
public class RootSelector {

  public static Optional<String> select(final SchemaIndex index) {
    if (index.elements().isEmpty()) {
      return Optional.empty();
    }
    final Predicate<ElementDecl> unreferenced = e -> !index.isReferenced(e.name());

    Optional<ElementDecl> choice =
        first(index, unreferenced.and(ElementDecl::global).and(e -> hasComplexContent(index, e)));
    if (choice.isEmpty()) {
      choice = first(index, unreferenced.and(ElementDecl::global));
    }
    if (choice.isEmpty()) {
      choice = first(index, unreferenced);
    }
    final String root =
        choice.map(ElementDecl::name).orElseGet(() -> index.elements().keySet().iterator().next());
    log.debug("Selected root element '{}'", root);
    return Optional.of(root);
  }

  private static Optional<ElementDecl> first(
      final SchemaIndex index, final Predicate<ElementDecl> filter) {
    return index.elements().values().stream().filter(filter).findFirst();
  }

  private static boolean hasComplexContent(final SchemaIndex index, final ElementDecl element) {
    if (element.inlineComplexType() != null) {
      return true;
    }
    return element.type() != null
        && !index.isBuiltin(element.type())
        && index.complexType(element.type().localName()).isPresent();
  }
}
