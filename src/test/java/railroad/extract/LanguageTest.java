package railroad.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class LanguageTest {

  @Test
  public void fromExtension() {
    assertEquals(Language.PYTHON, Language.fromFileName("scripts/match.py"));
    assertEquals(Language.RUST, Language.fromFileName("src/main.rs"));
    assertEquals(Language.JAVASCRIPT, Language.fromFileName("app.JS"));
    assertEquals(Language.JAVA, Language.fromFileName("Main.java"));
  }

  @Test
  public void unknownExtension() {
    final var error = assertThrows(UnsupportedLanguageException.class, () -> Language.fromFileName("notes.txt"));
    assertEquals("txt", error.extension);
  }

  @Test
  public void missingExtension() {
    final var error = assertThrows(UnsupportedLanguageException.class, () -> Language.fromFileName("dir.d/Makefile"));
    assertEquals("", error.extension);
  }

  @Test
  public void rawDelimitersPairUp() {
    assertThrows(
      IllegalArgumentException.class,
      () -> new StringFormat(List.of("\""), '\\', List.of("r\""), List.of())
    );
  }
}
