package com.cactisynth;

/**
 * Base class for failures reported by the project and voicebank layer.
 *
 * <p>Runtime exception, like the rest of the hierarchy: callers that care about a particular
 * failure kind catch the subclass, everything else propagates.
 */
public class CactiSynthException extends RuntimeException {

  public CactiSynthException(String message) {
    super(message);
  }

  public CactiSynthException(String message, Throwable cause) {
    super(message, cause);
  }
}
