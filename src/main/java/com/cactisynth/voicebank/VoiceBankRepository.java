package com.cactisynth.voicebank;

import com.cactisynth.config.CactiSynthProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of scanned voicebanks, keyed by normalised root path.
 *
 * <p>Scanning a large voicebank walks thousands of files, so the result is kept in a bounded
 * Caffeine cache. A cached voicebank is the snapshot of its last scan; call {@link #reload(Path)}
 * after the directory changes.
 */
@Repository
public class VoiceBankRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceBankRepository.class);

  private final VoiceBankLoader loader;
  private final Cache<Path, VoiceBank> cache;

  public VoiceBankRepository(VoiceBankLoader loader, CactiSynthProperties properties) {
    this.loader = loader;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.voicebankCache().maxSize())
            .expireAfterAccess(Duration.ofMinutes(properties.voicebankCache().expireAfterMinutes()))
            .build();
  }

  /** The cached voicebank for {@code root}, scanning it on first use. */
  public VoiceBank findOrLoad(Path root) {
    return cache.get(key(root), loader::load);
  }

  public Optional<VoiceBank> findCached(Path root) {
    return Optional.ofNullable(cache.getIfPresent(key(root)));
  }

  /** Scan {@code root} again and replace any cached snapshot. */
  public VoiceBank reload(Path root) {
    Path key = key(root);
    VoiceBank voiceBank = loader.load(key);
    cache.put(key, voiceBank);
    LOGGER.debug("Reloaded voicebank: {}", key);
    return voiceBank;
  }

  public void evict(Path root) {
    cache.invalidate(key(root));
  }

  private static Path key(Path root) {
    return root.toAbsolutePath().normalize();
  }
}
