package com.cactisynth.ust;

import java.util.List;
import java.util.Locale;

/**
 * A bracketed section of a UST file and its trimmed body lines.
 *
 * @param header the header line as written, e.g. {@code [#0003]}
 * @param lines body lines up to the next header, trimmed, blank lines included
 */
record UstChunk(String header, List<String> lines) {

  UstChunk {
    lines = List.copyOf(lines);
  }

  /** Header without brackets and leading '#', case-folded: {@code [#SETTING]} becomes "setting". */
  String name() {
    String name = header.strip();
    if (name.startsWith("[")) {
      name = name.substring(1);
    }
    if (name.endsWith("]")) {
      name = name.substring(0, name.length() - 1);
    }
    while (name.startsWith("#")) {
      name = name.substring(1);
    }
    return name.toLowerCase(Locale.ROOT);
  }

  boolean isVersion() {
    return name().equals("version");
  }

  boolean isSetting() {
    return name().equals("setting");
  }

  boolean isNote() {
    String name = name();
    return !name.isEmpty() && name.chars().allMatch(c -> c >= '0' && c <= '9');
  }

  boolean isRecognized() {
    return isVersion() || isSetting() || isNote();
  }
}
