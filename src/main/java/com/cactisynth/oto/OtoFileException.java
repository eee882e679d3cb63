package com.cactisynth.oto;

import com.cactisynth.CactiSynthException;

/** Thrown when an oto.ini file cannot be read or written. */
public class OtoFileException extends CactiSynthException {

  public OtoFileException(String message) {
    super(message);
  }

  public OtoFileException(String message, Throwable cause) {
    super(message, cause);
  }
}
