package ca.gc.cra.vigil.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void mergesCommonAndProfileSections() throws IOException {
    Path file = tempDir.resolve("vigil.yaml");
    Files.writeString(file, """
        common:
          customErrorMessage: Please check the value
          maxLength: 64
        Amount:
          min: 0
          maxLength: 32
          decimals:
            max: 2
        upload:
          acceptedFileExtensions: [pdf, .png]
          allowSpecialChars: false
        """);

    Map<String, String> amount = YamlConfigLoader.load(file, "amount").orElseThrow();
    assertEquals("Please check the value", amount.get("customErrorMessage"));
    assertEquals("0", amount.get("min"));
    assertEquals("32", amount.get("maxLength"));
    assertEquals("2", amount.get("decimals.max"));

    Map<String, String> upload = YamlConfigLoader.load(file, "upload").orElseThrow();
    assertEquals("pdf,.png", upload.get("acceptedFileExtensions"));
    assertEquals("false", upload.get("allowSpecialChars"));
    assertEquals("64", upload.get("maxLength"));
  }

  @Test
  void withoutProfileOnlyCommonIsRead() throws IOException {
    Path file = tempDir.resolve("vigil.yaml");
    Files.writeString(file, """
        common:
          minLength: 2
        amount:
          min: 0
        """);

    assertEquals(Optional.of(Map.of("minLength", "2")), YamlConfigLoader.load(file, null));
  }

  @Test
  void timestampsAreRenderedAsIsoInstants() throws IOException {
    Path file = tempDir.resolve("vigil.yaml");
    Files.writeString(file, """
        applicant:
          birthDate: 1990-05-20
        """);

    assertEquals("1990-05-20T00:00:00Z", YamlConfigLoader.load(file, "applicant").orElseThrow().get("birthDate"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "amount").isEmpty());
  }

  @Test
  void missingProfileIsRejected() throws IOException {
    Path file = tempDir.resolve("vigil.yaml");
    Files.writeString(file, "common:\n  min: 1\n");
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(file, "amount"));
    assertTrue(ex.getMessage().startsWith("profile amount not found in "));
  }

  @Test
  void malformedDocumentsAreRejected() throws IOException {
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "common: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, null));

    Path scalar = tempDir.resolve("scalar.yaml");
    Files.writeString(scalar, "just text\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, null));

    Path nestedList = tempDir.resolve("nested.yaml");
    Files.writeString(nestedList, "common:\n  acceptedFileExtensions:\n    - [pdf]\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, null));
  }
}
