package ca.gc.cra.vigil.application.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vigil.application.InputValidator;
import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchValidationUseCaseTest {
  private final BatchValidationUseCase useCase = new BatchValidationUseCase(InputValidator.standard());

  @TempDir Path tempDir;

  @Test
  void validatesEveryLineOfAFile() throws IOException {
    Path input = tempDir.resolve("ibans.txt");
    Files.writeString(input, """
        GB82 WEST 1234 5698 7654 32

        GB82WEST12345698765433
        """);
    List<LineOutcome> outcomes = new ArrayList<>();

    BatchSummary summary = useCase.run(input, InputType.IBAN, ValidationConfig.none(), true, outcomes::add);

    assertEquals(new BatchSummary(3, 1, 1, 1), summary);
    assertFalse(summary.allValid());
    assertEquals(2, outcomes.size());
    assertEquals(1, outcomes.get(0).lineNumber());
    assertEquals("GB82WEST12345698765432", outcomes.get(0).result().normalizedValue());
    assertEquals(3, outcomes.get(1).lineNumber());
    assertEquals("Invalid IBAN checksum", outcomes.get(1).result().errorMessage());
  }

  @Test
  void blankLinesFailWhenNotSkipped() throws IOException {
    List<LineOutcome> outcomes = new ArrayList<>();

    BatchSummary summary = useCase.run(new StringReader("a@b.com\n\n"), InputType.EMAIL, null, false, outcomes::add);

    assertEquals(new BatchSummary(2, 1, 1, 0), summary);
    assertEquals("Email is required", outcomes.get(1).result().errorMessage());
  }

  @Test
  void emptyInputIsAllValid() throws IOException {
    BatchSummary summary = useCase.run(new StringReader(""), InputType.GTIN, null, true, outcome -> { });
    assertEquals(0, summary.total());
    assertTrue(summary.allValid());
  }

  @Test
  void missingFilePropagatesIoException() {
    Path missing = tempDir.resolve("missing.txt");
    assertThrows(IOException.class,
        () -> useCase.run(missing, InputType.GTIN, null, true, outcome -> { }));
  }
}
