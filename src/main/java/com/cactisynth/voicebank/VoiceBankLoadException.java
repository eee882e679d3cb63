package com.cactisynth.voicebank;

import com.cactisynth.CactiSynthException;

/** Thrown when a voicebank directory cannot be scanned. */
public class VoiceBankLoadException extends CactiSynthException {

  public VoiceBankLoadException(String message) {
    super(message);
  }

  public VoiceBankLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
