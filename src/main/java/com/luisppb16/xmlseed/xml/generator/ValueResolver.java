/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml.generator;

import com.luisppb16.xmlseed.config.GenerationConfig;
import com.luisppb16.xmlseed.model.ValueConstraint;
import com.luisppb16.xmlseed.registry.BuiltinType;
import com.luisppb16.xmlseed.registry.BuiltinTypeRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a built-in type name and a {@link ValueConstraint} into one literal.
 *
 * <p>An enumeration always wins. Otherwise the type's {@link
 * com.luisppb16.xmlseed.registry.ValueFamily} picks the strategy:
 *
 * <ul>
 *   <li>string: a digit run for digit-shaped patterns, a word for any other pattern, else free
 *       text fitted to the length facets;
 *   <li>name tokens ({@code Name}, {@code NCName}, {@code ID} and the like): words run together
 *       without whitespace; {@code language}: a two-letter tag;
 *   <li>integer: uniform in {@code [minInclusive or 1, maxInclusive or 1000]}, exclusive bounds
 *       shifted by one, clamped to the type's own range; a single declared bound outside the
 *       default window moves the other end so it stays within 1000 of the declared one;
 *   <li>decimal: uniform in {@code [1.00, 1000.00]} with two decimals, declared bounds ignored;
 *   <li>boolean, date, dateTime, time, anyURI: the matching literal.
 * </ul>
 *
 * <p>Unknown types resolve to a word. Nothing here throws on schema content.
 */
@Slf4j
public final class ValueResolver {

  private static final long DEFAULT_MIN = 1L;
  private static final long DEFAULT_MAX = 1000L;
  private static final long DEFAULT_NEGATIVE_MIN = -1000L;
  private static final double DECIMAL_MIN = 1.0;
  private static final double DECIMAL_MAX = 1000.0;
  private static final int DEFAULT_DIGIT_COUNT = 5;
  private static final List<String> LANGUAGE_TAGS =
      List.of("en", "es", "fr", "de", "it", "pt", "nl");

  private static final Pattern DIGIT_RUN =
      Pattern.compile("^(?:\\\\d|\\[0-9\\])\\{(\\d+)(?:,(\\d+))?\\}$");

  private final ValueSynthesizer synthesizer;
  private final Random random;
  private final GenerationConfig config;

  public ValueResolver(
      final ValueSynthesizer synthesizer, final Random random, final GenerationConfig config) {
    this.synthesizer = Objects.requireNonNull(synthesizer, "Value synthesizer cannot be null");
    this.random = Objects.requireNonNull(random, "Random cannot be null");
    this.config = Objects.requireNonNullElse(config, GenerationConfig.defaults());
  }

  public String resolve(final String typeName, final ValueConstraint constraint) {
    final ValueConstraint c = Objects.requireNonNullElse(constraint, ValueConstraint.empty());
    if (c.hasEnumeration()) {
      return pick(c.enumeration());
    }
    final Optional<BuiltinType> builtin = BuiltinTypeRegistry.lookup(typeName);
    if (builtin.isEmpty()) {
      return synthesizer.word();
    }
    final BuiltinType type = builtin.get();
    return switch (type.family()) {
      case STRING -> string(c);
      case NAME -> name(c);
      case LANGUAGE -> pick(LANGUAGE_TAGS);
      case INTEGER -> Long.toString(integer(type, c));
      case DECIMAL -> decimal();
      case BOOLEAN -> Boolean.toString(random.nextBoolean());
      case DATE -> synthesizer.date();
      case DATE_TIME -> synthesizer.dateTime();
      case TIME -> synthesizer.time();
      case URI -> synthesizer.url();
    };
  }

  /** Uniform pick, also used for choice branches and union members. */
  public <T> T pick(final List<T> values) {
    return values.get(random.nextInt(values.size()));
  }

  private String string(final ValueConstraint c) {
    if (c.hasPattern()) {
      return fromPattern(c.pattern().trim(), c);
    }
    final int max;
    final int min;
    if (c.length() != null) {
      max = c.length();
      min = c.length();
    } else {
      final int declaredMin = c.minLength() != null ? c.minLength() : 0;
      max = c.maxLength() != null
          ? Math.max(c.maxLength(), declaredMin)
          : Math.max(config.defaultStringMaxLength(), declaredMin);
      min = c.minLength() != null ? declaredMin : Math.min(1, max);
    }
    if (max == 0) {
      return "";
    }
    return fitLength(synthesizer.sentence(max), min, max);
  }

  /** Words run together, so the value stays a single name token. */
  private String name(final ValueConstraint c) {
    if (c.hasPattern()) {
      return fromPattern(c.pattern().trim(), c);
    }
    final int min;
    final int max;
    if (c.length() != null) {
      min = Math.max(1, c.length());
      max = min;
    } else {
      min = c.minLength() != null ? Math.max(1, c.minLength()) : 1;
      max = c.maxLength() != null ? Math.max(min, c.maxLength()) : Integer.MAX_VALUE;
    }
    final StringBuilder sb = new StringBuilder();
    while (sb.length() < min) {
      final String word = synthesizer.word();
      sb.append(word == null || word.isBlank() ? "x" : word.strip());
    }
    if (sb.length() > max) {
      sb.setLength(max);
    }
    return sb.toString();
  }

  private String fromPattern(final String pattern, final ValueConstraint c) {
    final Matcher matcher = DIGIT_RUN.matcher(pattern);
    if (matcher.matches()) {
      final int lo = Integer.parseInt(matcher.group(1));
      final int hi = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : lo;
      return digits(uniform(Math.min(lo, hi), Math.max(lo, hi)));
    }
    if (pattern.contains("\\d") || pattern.contains("[0-9]")) {
      if (c.length() != null) {
        return digits(c.length());
      }
      if (c.minLength() != null || c.maxLength() != null) {
        final int lo = c.minLength() != null ? c.minLength() : 1;
        final int hi = c.maxLength() != null ? c.maxLength() : Math.max(lo, DEFAULT_DIGIT_COUNT);
        return digits(uniform(Math.min(lo, hi), Math.max(lo, hi)));
      }
      return digits(DEFAULT_DIGIT_COUNT);
    }
    return synthesizer.word();
  }

  private long integer(final BuiltinType type, final ValueConstraint c) {
    final long typeMin = type.min() != null ? type.min() : Long.MIN_VALUE;
    final long typeMax = type.max() != null ? type.max() : Long.MAX_VALUE;

    final Optional<Long> minInclusive = bound(c.minInclusive(), RoundingMode.CEILING, "minInclusive");
    final Optional<Long> minExclusive = bound(c.minExclusive(), RoundingMode.FLOOR, "minExclusive");
    final Optional<Long> maxInclusive = bound(c.maxInclusive(), RoundingMode.FLOOR, "maxInclusive");
    final Optional<Long> maxExclusive = bound(c.maxExclusive(), RoundingMode.CEILING, "maxExclusive");

    final Optional<Long> declaredMin =
        minInclusive.isPresent() || minExclusive.isPresent()
            ? Optional.of(Math.max(
                minInclusive.orElse(Long.MIN_VALUE),
                minExclusive.map(v -> v == Long.MAX_VALUE ? v : v + 1).orElse(Long.MIN_VALUE)))
            : Optional.empty();
    final Optional<Long> declaredMax =
        maxInclusive.isPresent() || maxExclusive.isPresent()
            ? Optional.of(Math.min(
                maxInclusive.orElse(Long.MAX_VALUE),
                maxExclusive.map(v -> v == Long.MIN_VALUE ? v : v - 1).orElse(Long.MAX_VALUE)))
            : Optional.empty();

    long min;
    long max;
    if (declaredMin.isPresent() && declaredMax.isPresent()) {
      min = Math.min(declaredMin.get(), declaredMax.get());
      max = Math.max(declaredMin.get(), declaredMax.get());
    } else if (declaredMin.isPresent()) {
      // The default window slides up to the declared floor.
      min = declaredMin.get();
      max = Math.max(min, Math.min(DEFAULT_MAX, typeMax));
      if (max == min) {
        max = saturatedAdd(min, DEFAULT_MAX - DEFAULT_MIN);
      }
    } else if (declaredMax.isPresent()) {
      max = declaredMax.get();
      min = typeMax < DEFAULT_MIN ? DEFAULT_NEGATIVE_MIN : DEFAULT_MIN;
      if (min >= max) {
        min = saturatedAdd(max, -(DEFAULT_MAX - DEFAULT_MIN));
      }
    } else {
      min = typeMax < DEFAULT_MIN ? DEFAULT_NEGATIVE_MIN : DEFAULT_MIN;
      max = Math.min(DEFAULT_MAX, typeMax);
    }
    min = Math.max(min, typeMin);
    max = Math.min(max, typeMax);
    if (max < min) {
      max = min;
    }
    if (min == max) {
      return min;
    }
    return random.nextLong(min, max == Long.MAX_VALUE ? max : max + 1);
  }

  private static long saturatedAdd(final long value, final long delta) {
    try {
      return Math.addExact(value, delta);
    } catch (final ArithmeticException e) {
      return delta > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
    }
  }

  private String decimal() {
    final double value = DECIMAL_MIN + random.nextDouble() * (DECIMAL_MAX - DECIMAL_MIN);
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  private Optional<Long> bound(final String raw, final RoundingMode mode, final String facet) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      final BigDecimal value = new BigDecimal(raw.trim()).setScale(0, mode);
      if (value.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
        return Optional.of(Long.MAX_VALUE);
      }
      if (value.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) < 0) {
        return Optional.of(Long.MIN_VALUE);
      }
      return Optional.of(value.longValueExact());
    } catch (final NumberFormatException | ArithmeticException e) {
      log.warn("Ignoring malformed {} facet value '{}'", facet, raw);
      return Optional.empty();
    }
  }

  /**
   * Pads with words up to {@code min} and cuts at {@code max}. The result never ends in whitespace,
   * so whitespace-collapsing types keep the same length.
   */
  private String fitLength(final String text, final int min, final int max) {
    final StringBuilder sb = new StringBuilder(text == null ? "" : text.strip());
    while (sb.length() < min) {
      final String word = synthesizer.word();
      if (word == null || word.isEmpty()) {
        break;
      }
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(word);
    }
    if (sb.length() > max) {
      sb.setLength(max);
    }
    final int last = sb.length() - 1;
    if (last >= 0 && Character.isWhitespace(sb.charAt(last))) {
      sb.setCharAt(last, 'x');
    }
    while (sb.length() < min) {
      sb.append('x');
    }
    return sb.toString();
  }

  private String digits(final int count) {
    final StringBuilder sb = new StringBuilder(count);
    for (int i = 0; i < count; i++) {
      sb.append((char) ('0' + random.nextInt(10)));
    }
    return sb.toString();
  }

  private int uniform(final int min, final int max) {
    return min + random.nextInt(max - min + 1);
  }
}
