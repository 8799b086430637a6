package railroad;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.io.IOException;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

/**
 * Runs every case in {@code diagrams.txt} through the full pipeline.
 */
public class DiagramFixturesTest {

  private static final String FIXTURES = "/diagrams.txt";

  private static List<DiagramCase> readFixtures() throws IOException {
    try (var reader = new DiagramFileReader(FIXTURES)) {
      return reader.readAll();
    }
  }

  @Test
  public void fixturesAreNotEmpty() throws IOException {
    final List<DiagramCase> cases = readFixtures();
    assertFalse(cases.isEmpty());
    for (DiagramCase testCase : cases) {
      assertFalse(testCase.rows.isEmpty(), "No rows for " + testCase.getSummary());
    }
  }

  @TestFactory
  public Stream<DynamicTest> fixtures() throws IOException {
    return readFixtures().stream().map(testCase ->
      DynamicTest.dynamicTest(testCase.getSummary(), () -> {
        final Diagram diagram = RailroadRenderer.renderDiagram(testCase.pattern);
        assertEquals(
          String.join("\n", testCase.rows),
          diagram.text(),
          "Unexpected diagram for " + testCase.getSummary()
        );
        assertEquals(testCase.rows.size(), diagram.height());
        assertEquals(testCase.rows.get(0).codePointCount(0, testCase.rows.get(0).length()), diagram.width());
      })
    );
  }
}
