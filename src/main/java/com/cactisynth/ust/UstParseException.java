package com.cactisynth.ust;

import com.cactisynth.CactiSynthException;

/**
 * Thrown when UST input cannot be turned into a project at all.
 *
 * <p>Individual bad lines and values are recovered from inside the parser; this exception means
 * the input was unreadable or contained no recognizable chunk, and no project was produced.
 */
public class UstParseException extends CactiSynthException {

  public UstParseException(String message) {
    super(message);
  }

  public UstParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
