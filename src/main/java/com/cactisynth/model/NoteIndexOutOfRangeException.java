package com.cactisynth.model;

import com.cactisynth.CactiSynthException;

/**
 * Thrown when a note is addressed by a position the project does not have.
 *
 * <p>The project is never modified when this is thrown.
 */
public class NoteIndexOutOfRangeException extends CactiSynthException {

  private final int index;
  private final int size;

  public NoteIndexOutOfRangeException(int index, int size) {
    super(String.format("Note index %d is out of range for a project with %d notes", index, size));
    this.index = index;
    this.size = size;
  }

  public int getIndex() {
    return index;
  }

  public int getSize() {
    return size;
  }
}
