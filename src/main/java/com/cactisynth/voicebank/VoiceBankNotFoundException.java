package com.cactisynth.voicebank;

import java.nio.file.Path;

/** Thrown when the voicebank root is missing or is not a directory. */
public class VoiceBankNotFoundException extends VoiceBankLoadException {

  private final Path root;

  public VoiceBankNotFoundException(Path root) {
    super(root + " is not a directory, or does not exist");
    this.root = root;
  }

  public Path getRoot() {
    return root;
  }
}
