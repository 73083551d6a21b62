/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml;

import com.luisppb16.xmlseed.config.GenerationConfig;
import com.luisppb16.xmlseed.model.ElementDecl;
import com.luisppb16.xmlseed.schema.SchemaDocumentLoader;
import com.luisppb16.xmlseed.schema.SchemaIndex;
import com.luisppb16.xmlseed.schema.SchemaIndexBuilder;
import com.luisppb16.xmlseed.util.NoRootElementException;
import com.luisppb16.xmlseed.xml.generator.ContentGenerator;
import com.luisppb16.xmlseed.xml.generator.FakerValueSynthesizer;
import com.luisppb16.xmlseed.xml.generator.ValueResolver;
import com.luisppb16.xmlseed.xml.generator.ValueSynthesizer;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import lombok.Builder;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.dom4j.Document;
import org.dom4j.DocumentHelper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point of the generator: loads a schema into a checked {@link XmlSchemaSession} and
 * produces random instance documents from it.
 *
 * <p>Loading parses, indexes and cycle-checks the schema; a schema that fails any step never
 * reaches generation. Each generation call builds a fresh output tree and shares nothing mutable
 * with other calls.
 */
@Slf4j
@UtilityClass
public class XmlGenerator {

  @NotNull
  public static XmlSchemaSession load(@NotNull final Path schema) {
    final SchemaIndex index = SchemaIndexBuilder.build(SchemaDocumentLoader.parse(schema));
    return new XmlSchemaSession(index, CycleDetector.check(index).orThrow(), schema);
  }

  @NotNull
  public static XmlSchemaSession fromString(@NotNull final String markup) {
    final SchemaIndex index = SchemaIndexBuilder.build(SchemaDocumentLoader.parse(markup));
    return new XmlSchemaSession(index, CycleDetector.check(index).orThrow(), null);
  }

  /** Generates with default settings; {@code rootName == null} lets {@link RootSelector} choose. */
  @NotNull
  public static Document generateDocument(
      @NotNull final XmlSchemaSession session, @Nullable final String rootName) {
    return generate(GenerationParameters.builder().session(session).rootName(rootName).build())
        .document();
  }

  /** Runs the cycle check over {@code index} first; a cyclic index never generates. */
  @NotNull
  public static Document generateDocument(
      @NotNull final SchemaIndex index, @Nullable final String rootName) {
    final XmlSchemaSession session =
        new XmlSchemaSession(index, CycleDetector.check(index).orThrow(), null);
    return generateDocument(session, rootName);
  }

  @NotNull
  public static GenerationResult generate(@NotNull final GenerationParameters parameters) {
    final long start = System.nanoTime();
    final XmlSchemaSession session =
        Objects.requireNonNull(parameters.session(), "Schema session cannot be null");
    final SchemaIndex index = session.index();
    final GenerationConfig config =
        Objects.requireNonNullElse(parameters.config(), GenerationConfig.defaults());
    final Random random =
        parameters.random() != null
            ? parameters.random()
            : config.seed() != null ? new Random(config.seed()) : new Random();
    final ValueSynthesizer synthesizer =
        parameters.synthesizer() != null
            ? parameters.synthesizer()
            : new FakerValueSynthesizer(random);

    final String rootName =
        parameters.rootName() != null
            ? parameters.rootName()
            : RootSelector.select(index)
                .orElseThrow(
                    () ->
                        new NoRootElementException(
                            "Schema declares no elements that could serve as document root"));
    final ElementDecl root =
        index
            .element(rootName)
            .orElseThrow(
                () ->
                    new NoRootElementException(
                        "Root element '" + rootName + "' is not declared in the schema"));

    final Document document = DocumentHelper.createDocument();
    final ContentGenerator generator =
        new ContentGenerator(index, new ValueResolver(synthesizer, random, config), random, config);
    generator.generateRoot(root, document);

    final double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
    log.info(
        "Generated <{}> with {} elements and {} attributes in {} s",
        rootName,
        generator.getElementCount(),
        generator.getAttributeCount(),
        String.format(Locale.ROOT, "%.3f", seconds));
    return new GenerationResult(
        document, rootName, generator.getElementCount(), generator.getAttributeCount());
  }

  /**
   * Inputs of one generation call. Only {@code session} is required: {@code config} defaults to
   * {@link GenerationConfig#defaults()}, {@code random} to one seeded from the config (or unseeded),
   * {@code synthesizer} to a Datafaker one sharing that random source.
   */
  @Builder(toBuilder = true)
  public record GenerationParameters(
      XmlSchemaSession session,
      String rootName,
      Random random,
      GenerationConfig config,
      ValueSynthesizer synthesizer) {}

  public record GenerationResult(
      Document document, String rootName, int elementCount, int attributeCount) {}
}
