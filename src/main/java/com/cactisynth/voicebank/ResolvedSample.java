package com.cactisynth.voicebank;

import com.cactisynth.oto.OtoEntry;
import java.nio.file.Path;

/**
 * An OTO entry together with the sample file it describes.
 *
 * @param subdirectory key of the OTO setting the entry came from
 * @param entry the timing entry
 * @param samplePath the sample file, resolved against the oto.ini's directory
 */
public record ResolvedSample(String subdirectory, OtoEntry entry, Path samplePath) {}
