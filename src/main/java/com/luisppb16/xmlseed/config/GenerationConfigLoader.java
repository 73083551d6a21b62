/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

/** Reads a {@link GenerationConfig} from a JSON file; absent keys keep their defaults. */
@Slf4j
@UtilityClass
public class GenerationConfigLoader {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  @NotNull
  public static GenerationConfig load(@NotNull final Path path) {
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Configuration file not found: " + path);
    }
    try {
      final GenerationConfig config = MAPPER.readValue(path.toFile(), GenerationConfig.class);
      log.debug("Configuration loaded from {}: {}", path, config);
      return config != null ? config : GenerationConfig.defaults();
    } catch (final ValueInstantiationException e) {
      final Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new IllegalArgumentException(
          "Invalid configuration in " + path + ": " + cause.getMessage(), e);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Malformed configuration file " + path + ": " + e.getOriginalMessage(), e);
    } catch (final IOException e) {
      throw new UncheckedIOException("Unable to read configuration file " + path, e);
    }
  }
}
