package com.cactisynth.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.charset.Charset;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for project and voicebank handling.
 *
 * <p>These map to the "cactisynth.*" keys in application.yml. Components receive this record
 * through their constructors, so there is no global settings object to mutate.
 */
@ConfigurationProperties(prefix = "cactisynth")
@Validated
public record CactiSynthProperties(
    @DefaultValue("./output") @NotBlank String outputPath,
    @DefaultValue("Shift_JIS") @NotBlank String textEncoding,
    @DefaultValue(".okmt") @NotBlank String projectExtension,
    @DefaultValue(".wav") @NotBlank String sampleExtension,
    @DefaultValue @Valid VoicebankCacheProperties voicebankCache) {

  public CactiSynthProperties {
    if (voicebankCache == null) {
      voicebankCache = new VoicebankCacheProperties(16, 60);
    }
  }

  /** Properties with the same defaults as application.yml. */
  public static CactiSynthProperties defaults() {
    return new CactiSynthProperties("./output", "Shift_JIS", ".okmt", ".wav", null);
  }

  /** Copy of these properties writing projects to a different directory. */
  public CactiSynthProperties withOutputPath(Path outputPath) {
    return new CactiSynthProperties(
        outputPath.toString(), textEncoding, projectExtension, sampleExtension, voicebankCache);
  }

  /** Charset used for UST, OTO and voicebank text files. */
  public Charset charset() {
    return Charset.forName(textEncoding);
  }

  public Path outputDirectory() {
    return Path.of(outputPath);
  }

  public record VoicebankCacheProperties(
      @DefaultValue("16") @Positive int maxSize,
      @DefaultValue("60") @Positive int expireAfterMinutes) {}
}
