package com.cactisynth.voicebank;

import com.cactisynth.oto.OtoEntry;
import com.cactisynth.oto.OtoField;
import com.cactisynth.oto.OtoSetting;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A scanned sample library: descriptive metadata plus one OTO setting per oto.ini found.
 *
 * <p>Instances are snapshots of a directory scan. {@link #getOtoCount()} and {@link
 * #getFileCount()} are computed once by the loader and are not updated afterwards.
 */
public class VoiceBank {

  public static final String DEFAULT_SAMPLE = "Random";

  private final Path root;
  private final String name;
  private final String author;
  private final String image;
  private final String sample;
  private final String web;
  private final String readme;
  private final SortedMap<String, OtoSetting> otoSettings;
  private final Map<String, String> prefixMap = Collections.emptyMap();
  private final int otoCount;
  private final int fileCount;

  VoiceBank(
      Path root,
      CharacterInfo character,
      String readme,
      Map<String, OtoSetting> otoSettings,
      int fileCount) {
    this.root = Objects.requireNonNull(root, "root");
    this.name = character.name();
    this.author = character.author();
    this.image = character.image();
    this.sample = character.sample().isEmpty() ? DEFAULT_SAMPLE : character.sample();
    this.web = character.web();
    this.readme = Objects.requireNonNull(readme, "readme");
    this.otoSettings = Collections.unmodifiableSortedMap(new TreeMap<>(otoSettings));
    this.otoCount = this.otoSettings.values().stream().mapToInt(OtoSetting::size).sum();
    this.fileCount = fileCount;
  }

  /**
   * Every matching entry across all OTO settings, ordered by subdirectory name and then by file
   * order. When nothing matches the result is a single {@link OtoEntry#DEFAULT}.
   */
  public List<OtoEntry> findEntries(OtoField field, String value) {
    List<OtoEntry> matches = new ArrayList<>();
    for (OtoSetting setting : otoSettings.values()) {
      matches.addAll(setting.findMatches(field, value));
    }
    return matches.isEmpty() ? List.of(OtoEntry.DEFAULT) : Collections.unmodifiableList(matches);
  }

  public List<OtoEntry> findEntries(String fieldName, String value) {
    return findEntries(OtoField.fromName(fieldName), value);
  }

  /** First entry with the given alias, with its sample file located on disk. */
  public Optional<ResolvedSample> resolveAlias(String alias) {
    for (Map.Entry<String, OtoSetting> setting : otoSettings.entrySet()) {
      List<OtoEntry> matches = setting.getValue().findMatches(OtoField.ALIAS, alias);
      if (!matches.isEmpty()) {
        OtoEntry entry = matches.get(0);
        Path directory = setting.getValue().getPath().toAbsolutePath().getParent();
        return Optional.of(
            new ResolvedSample(setting.getKey(), entry, directory.resolve(entry.file())));
      }
    }
    return Optional.empty();
  }

  public Path getRoot() {
    return root;
  }

  public String getName() {
    return name;
  }

  public String getAuthor() {
    return author;
  }

  public String getImage() {
    return image;
  }

  public String getSample() {
    return sample;
  }

  public String getWeb() {
    return web;
  }

  public String getReadme() {
    return readme;
  }

  /** OTO settings keyed by the name of the directory holding each oto.ini. */
  public SortedMap<String, OtoSetting> getOtoSettings() {
    return otoSettings;
  }

  /** Reserved for prefix.map support; always empty. */
  public Map<String, String> getPrefixMap() {
    return prefixMap;
  }

  public int getOtoCount() {
    return otoCount;
  }

  public int getFileCount() {
    return fileCount;
  }

  @Override
  public String toString() {
    return String.format(
        "VoiceBank[name=%s, root=%s, settings=%d, otoCount=%d, fileCount=%d]",
        name, root, otoSettings.size(), otoCount, fileCount);
  }
}
