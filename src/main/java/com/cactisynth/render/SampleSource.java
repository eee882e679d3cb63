package com.cactisynth.render;

import java.nio.file.Path;

/** Decodes voicebank sample files. Audio decoding lives outside this project. */
public interface SampleSource {

  /**
   * Read a sample file.
   *
   * @throws VoiceRenderException if the file cannot be decoded
   */
  AudioClip read(Path samplePath);
}
