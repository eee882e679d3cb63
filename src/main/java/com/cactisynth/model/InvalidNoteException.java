package com.cactisynth.model;

import com.cactisynth.CactiSynthException;

/** Thrown when a note field is outside its documented range. */
public class InvalidNoteException extends CactiSynthException {

  private final String field;
  private final long value;

  public InvalidNoteException(String field, long value) {
    super(String.format("Note field %s must be >= 0 but was %d", field, value));
    this.field = field;
    this.value = value;
  }

  public String getField() {
    return field;
  }

  public long getValue() {
    return value;
  }
}
