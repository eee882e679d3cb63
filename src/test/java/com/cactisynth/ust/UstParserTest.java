package com.cactisynth.ust;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cactisynth.config.CactiSynthProperties;
import com.cactisynth.model.Note;
import com.cactisynth.model.Project;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UstParserTest {

  private static final String SAMPLE_UST =
      String.join(
          "\r\n",
          "[#VERSION]",
          "UST Version1.2",
          "[#SETTING]",
          "Tempo=150.00",
          "Tracks=1",
          "ProjectName=新規プロジェクト",
          "VoiceDir=%VOICE%uta",
          "OutFile=out.wav",
          "CacheDir=cache.cache",
          "Tool1=wavtool.exe",
          "Tool2=resampler.exe",
          "Mode2=True",
          "Flags=g-5",
          "[#0000]",
          "Length=480",
          "Lyric=R",
          "NoteNum=60",
          "PreUtterance=",
          "[#0001]",
          "Length=240",
          "Lyric=か",
          "NoteNum=62",
          "Velocity=120",
          "StartPoint=480",
          "[#TRACKEND]",
          "");

  @TempDir Path tempDir;

  private UstParser parser;

  @BeforeEach
  void setUp() {
    parser = new UstParser(CactiSynthProperties.defaults());
  }

  @Test
  void parse_shouldReadSettingAndSingleNote() {
    Project project = parser.parse("[#SETTING]\nTempo=140\n[#0000]\nLength=480\nLyric=あ\nNoteNum=60\n");

    assertThat(project.getTempo()).isEqualTo(140.0);
    assertThat(project.getNotes()).hasSize(1);
    Note note = project.getNotes().get(0);
    assertThat(note.length()).isEqualTo(480);
    assertThat(note.lyric()).isEqualTo("あ");
    assertThat(note.noteNum()).isEqualTo(60);
    assertThat(note.startPoint()).isZero();
  }

  @Test
  void parse_shouldMapAllSettingFields() {
    Project project = parser.parse(SAMPLE_UST);

    assertThat(project.getVersion()).isEqualTo("UST Version1.2");
    assertThat(project.getTempo()).isEqualTo(150.0);
    assertThat(project.getTracks()).isEqualTo(1);
    assertThat(project.getName()).isEqualTo("新規プロジェクト");
    assertThat(project.getVoiceDir()).isEqualTo(Path.of("%VOICE%uta"));
    assertThat(project.getOutFile()).isEqualTo(Path.of("out.wav"));
    assertThat(project.getCacheDir()).isEqualTo(Path.of("cache.cache"));
  }

  @Test
  void parse_shouldCollectToolsModesAndFlagsInOrder() {
    Project project = parser.parse(SAMPLE_UST);

    assertThat(project.getTools()).containsExactly("wavtool.exe", "resampler.exe");
    assertThat(project.getModes()).containsExactly("True");
    assertThat(project.getFlags()).containsExactly("g-5");
  }

  @Test
  void parse_shouldKeepDuplicateToolsInEncounterOrder() {
    Project project = parser.parse("[#SETTING]\nTool1=a\nTool2=b\nTool1=a\n");

    assertThat(project.getTools()).containsExactly("a", "b", "a");
  }

  @Test
  void parse_shouldCoerceMissingNumbersToZero() {
    Project project = parser.parse(SAMPLE_UST);

    Note rest = project.getNotes().get(0);
    assertThat(rest.lyric()).isEqualTo("R");
    assertThat(rest.preUtterance()).isZero();
    assertThat(rest.velocity()).isZero();
    assertThat(rest.startPoint()).isZero();

    Note ka = project.getNotes().get(1);
    assertThat(ka.velocity()).isEqualTo(120);
    assertThat(ka.startPoint()).isEqualTo(480);
  }

  @Test
  void parse_shouldReplaceInvalidNumbersWithZero() {
    Project project =
        parser.parse("[#0000]\nLength=abc\nLyric=a\nNoteNum=-3\nIntensity=12.7\n");

    Note note = project.getNotes().get(0);
    assertThat(note.length()).isZero();
    assertThat(note.noteNum()).isZero();
    assertThat(note.intensity()).isEqualTo(12);
  }

  @Test
  void parse_shouldSkipLinesWithoutSeparator() {
    Project project = parser.parse("[#0000]\nLength=480\ngarbage\nLyric=a=b\n");

    Note note = project.getNotes().get(0);
    assertThat(note.length()).isEqualTo(480);
    assertThat(note.lyric()).isEqualTo("a=b");
  }

  @Test
  void parse_shouldNotCreateNoteForEmptyChunk() {
    Project project = parser.parse("[#VERSION]\nUST Version1.2\n[#0000]\n\n[#0001]\nLyric=a\n");

    assertThat(project.getNotes()).extracting(Note::lyric).containsExactly("a");
  }

  @Test
  void parse_shouldAcceptHeadersWithoutHashAndAnyCase() {
    Project project = parser.parse("[setting]\nTempo=90\n[#Version]\nv1\n[12]\nLyric=a\n");

    assertThat(project.getTempo()).isEqualTo(90.0);
    assertThat(project.getVersion()).isEqualTo("v1");
    assertThat(project.getNotes()).hasSize(1);
  }

  @Test
  void parse_shouldUseEmptyVersionForEmptyChunk() {
    Project project = parser.parse("[#VERSION]\n\n[#0000]\nLyric=a\n");

    assertThat(project.getVersion()).isEmpty();
  }

  @Test
  void parse_shouldFallBackToDefaultTempo() {
    Project project = parser.parse("[#SETTING]\nTempo=fast\nProjectName=\n");

    assertThat(project.getTempo()).isEqualTo(120.0);
    assertThat(project.getName()).isEqualTo("Untitled");
  }

  @Test
  void parse_shouldSortNotesByStartPoint() {
    Project project =
        parser.parse(
            "[#0000]\nLyric=c\nStartPoint=960\n[#0001]\nLyric=a\nStartPoint=0\n"
                + "[#0002]\nLyric=b\nStartPoint=480\n");

    assertThat(project.getNotes()).extracting(Note::lyric).containsExactly("a", "b", "c");
  }

  @Test
  void parse_shouldFailWithoutRecognizableChunk() {
    assertThatThrownBy(() -> parser.parse("[#PREV]\nLyric=a\n[#NEXT]\n"))
        .isInstanceOf(UstParseException.class)
        .hasMessageContaining("No recognizable chunk");
    assertThatThrownBy(() -> parser.parse("just some text"))
        .isInstanceOf(UstParseException.class);
    assertThatThrownBy(() -> parser.parse("")).isInstanceOf(UstParseException.class);
  }

  @Test
  void parseFile_shouldDecodeConfiguredEncoding() throws IOException {
    Path ust = tempDir.resolve("song.ust");
    Files.write(ust, SAMPLE_UST.getBytes(Charset.forName("Shift_JIS")));

    Project project = parser.parseFile(ust);

    assertThat(project.getName()).isEqualTo("新規プロジェクト");
    assertThat(project.getNotes()).extracting(Note::lyric).containsExactly("R", "か");
  }

  @Test
  void parseFile_shouldFailForMissingFile() {
    assertThatThrownBy(() -> parser.parseFile(tempDir.resolve("missing.ust")))
        .isInstanceOf(UstParseException.class)
        .hasMessageContaining("does not exist");
  }
}
