package com.cactisynth.render;

import com.cactisynth.CactiSynthException;

/** Thrown when pitch estimation, resynthesis or sample decoding fails for a note. */
public class VoiceRenderException extends CactiSynthException {

  public VoiceRenderException(String message) {
    super(message);
  }

  public VoiceRenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
