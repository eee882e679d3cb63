package com.cactisynth.voicebank;

import java.util.List;

/**
 * The fields read from a voicebank's character.txt.
 *
 * <p>Fields are matched in a fixed order: name, author, image, sample, web. A line is only
 * accepted if it starts with the prefix of the field currently expected; other lines are skipped
 * without moving on. Once the last field is reached the expected field stays there. A file that
 * lists its fields in a different order therefore leaves later fields empty.
 */
record CharacterInfo(String name, String author, String image, String sample, String web) {

  private static final List<String> FIELDS = List.of("name", "author", "image", "sample", "web");

  static final CharacterInfo EMPTY = new CharacterInfo("", "", "", "", "");

  static CharacterInfo parse(List<String> lines) {
    String[] values = {"", "", "", "", ""};
    int expected = 0;
    for (String raw : lines) {
      String line = raw.strip();
      String prefix = FIELDS.get(expected) + "=";
      if (!line.startsWith(prefix)) {
        continue;
      }
      values[expected] = line.substring(prefix.length());
      if (expected < FIELDS.size() - 1) {
        expected++;
      }
    }
    return new CharacterInfo(values[0], values[1], values[2], values[3], values[4]);
  }
}
