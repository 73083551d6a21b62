/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luisppb16.xmlseed.model.TypeName;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatch table from XML Schema built-in type names to their generation strategy, loaded once
 * from {@code /xsd-builtin-types.json}.
 *
 * <p>Lookups accept names with or without a namespace prefix; {@code xs:int}, {@code xsd:int} and
 * {@code int} all resolve to the same entry.
 */
@Slf4j
@UtilityClass
public class BuiltinTypeRegistry {

  private static final String BUILTIN_TYPES_JSON_PATH = "/xsd-builtin-types.json";
  private static final Map<String, BuiltinType> TYPES;

  static {
    Map<String, BuiltinType> tempTypes;
    try (final InputStream in =
        BuiltinTypeRegistry.class.getResourceAsStream(BUILTIN_TYPES_JSON_PATH)) {
      if (in == null) {
        log.error("Built-in type table not found: {}", BUILTIN_TYPES_JSON_PATH);
        throw new IllegalStateException(
            "Built-in type table not found: " + BUILTIN_TYPES_JSON_PATH);
      }
      final ObjectMapper mapper = new ObjectMapper();
      tempTypes = mapper.readValue(in, new TypeReference<Map<String, BuiltinType>>() {});
      log.debug("Loaded {} built-in types from {}", tempTypes.size(), BUILTIN_TYPES_JSON_PATH);
    } catch (final JsonProcessingException e) {
      log.error("Error parsing {}: {}", BUILTIN_TYPES_JSON_PATH, e.getMessage(), e);
      tempTypes = Collections.emptyMap();
    } catch (final IOException e) {
      log.error("Error reading {}: {}", BUILTIN_TYPES_JSON_PATH, e.getMessage(), e);
      tempTypes = Collections.emptyMap();
    } catch (final IllegalStateException e) {
      log.error(e.getMessage());
      tempTypes = Collections.emptyMap();
    }
    TYPES = Map.copyOf(tempTypes);
  }

  public static Optional<BuiltinType> lookup(final String typeName) {
    if (typeName == null || typeName.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(TYPES.get(TypeName.localPart(typeName)));
  }

  public static boolean isBuiltin(final String typeName) {
    return lookup(typeName).isPresent();
  }

  public static int size() {
    return TYPES.size();
  }
}
