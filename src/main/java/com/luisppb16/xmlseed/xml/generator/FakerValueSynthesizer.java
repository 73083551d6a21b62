/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.xmlseed.xml.generator;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Random;
import net.datafaker.Faker;

/**
 * {@link ValueSynthesizer} backed by Datafaker. Dates fall within the ten years before {@link
 * #DATE_ANCHOR}, a fixed day, so a seeded run yields the same literals whenever it is run.
 */
public final class FakerValueSynthesizer implements ValueSynthesizer {

  static final LocalDate DATE_ANCHOR = LocalDate.of(2025, 1, 1);
  static final int DAYS_BACK = 3650;
  private static final int SECONDS_PER_DAY = 86_400;
  private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

  private final Faker faker;

  public FakerValueSynthesizer(final Faker faker) {
    this.faker = Objects.requireNonNull(faker, "Faker cannot be null");
  }

  /** Shares {@code random} with Datafaker, so a seeded source makes the literals repeatable. */
  public FakerValueSynthesizer(final Random random) {
    this(new Faker(Objects.requireNonNull(random, "Random cannot be null")));
  }

  @Override
  public String word() {
    final String word = faker.lorem().word();
    return word == null || word.isBlank() ? "lorem" : word;
  }

  @Override
  public String sentence(final int maxChars) {
    final int limit = Math.max(1, maxChars);
    String text = faker.lorem().sentence().trim();
    if (text.length() > limit) {
      text = text.substring(0, limit).trim();
    }
    if (text.isEmpty()) {
      final String word = word();
      return word.length() > limit ? word.substring(0, limit) : word;
    }
    return text;
  }

  @Override
  public String date() {
    return pastDate().toString();
  }

  @Override
  public String dateTime() {
    return LocalDateTime.of(pastDate(), timeOfDay()).format(DATE_TIME);
  }

  @Override
  public String time() {
    return timeOfDay().format(TIME);
  }

  @Override
  public String url() {
    return faker.internet().url();
  }

  private LocalDate pastDate() {
    return DATE_ANCHOR.minusDays(faker.number().numberBetween(0, DAYS_BACK));
  }

  private LocalTime timeOfDay() {
    return LocalTime.ofSecondOfDay(faker.number().numberBetween(0, SECONDS_PER_DAY));
  }
}
