package com.cactisynth.oto;

import java.util.Locale;
import java.util.function.Function;

/** The fields of an {@link OtoEntry} that lookups can match on. */
public enum OtoField {
  FILE(OtoEntry::file),
  ALIAS(OtoEntry::alias),
  OFFSET(OtoEntry::offset),
  FIXED(OtoEntry::fixed),
  BLANK(OtoEntry::blank),
  PREUTTER(OtoEntry::preutter),
  OVERLAP(OtoEntry::overlap);

  private final Function<OtoEntry, Object> accessor;

  OtoField(Function<OtoEntry, Object> accessor) {
    this.accessor = accessor;
  }

  /**
   * Look up a field by its oto.ini name, e.g. "alias" or "preutter". Case-insensitive.
   *
   * @throws IllegalArgumentException if there is no such field
   */
  public static OtoField fromName(String name) {
    for (OtoField field : values()) {
      if (field.name().equalsIgnoreCase(name.strip())) {
        return field;
      }
    }
    throw new IllegalArgumentException("Unknown OTO field: " + name);
  }

  public Object valueOf(OtoEntry entry) {
    return accessor.apply(entry);
  }

  public boolean isNumeric() {
    return this != FILE && this != ALIAS;
  }

  /**
   * Whether {@code entry}'s field equals {@code value}. Numeric fields compare as numbers, so
   * "50" matches 50.0; a value that is not a number never matches a numeric field.
   */
  public boolean matches(OtoEntry entry, String value) {
    Object actual = valueOf(entry);
    if (!isNumeric()) {
      return actual.equals(value);
    }
    try {
      return (Double) actual == Double.parseDouble(value.strip());
    } catch (NumberFormatException e) {
      return false;
    }
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
