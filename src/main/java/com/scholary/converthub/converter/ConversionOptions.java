package com.scholary.converthub.converter;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the options applied to a conversion.
 *
 * <p>Options arrive as form fields, so values are strings; typed accessors parse on demand and
 * report malformed values as {@link ConversionException}. Blank values are dropped. Entries are
 * kept sorted so {@link #canonicalForm()} is stable for cache keys.
 */
public final class ConversionOptions {

  public static final ConversionOptions EMPTY = new ConversionOptions(Map.of());

  private final SortedMap<String, String> values;

  private ConversionOptions(Map<String, String> values) {
    SortedMap<String, String> copy = new TreeMap<>();
    values.forEach(
        (name, value) -> {
          if (name != null && value != null && !value.isBlank()) {
            copy.put(name, value.trim());
          }
        });
    this.values = Collections.unmodifiableSortedMap(copy);
  }

  public static ConversionOptions of(Map<String, String> values) {
    return values == null || values.isEmpty() ? EMPTY : new ConversionOptions(values);
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(values.get(name));
  }

  public String getOrDefault(String name, String defaultValue) {
    return values.getOrDefault(name, defaultValue);
  }

  public Optional<Integer> getInt(String name) {
    String value = values.get(name);
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Integer.parseInt(value));
    } catch (NumberFormatException e) {
      throw new ConversionException(
          String.format("Option '%s' must be an integer, got '%s'", name, value));
    }
  }

  public int getInt(String name, int defaultValue) {
    return getInt(name).orElse(defaultValue);
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    String value = values.get(name);
    return value == null ? defaultValue : Boolean.parseBoolean(value);
  }

  /** Stable {@code name=value&...} rendering, sorted by name. */
  public String canonicalForm() {
    return values.entrySet().stream()
        .map(entry -> entry.getKey() + "=" + entry.getValue())
        .collect(Collectors.joining("&"));
  }

  @JsonValue
  public Map<String, String> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ConversionOptions that && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ConversionOptions" + values;
  }
}
