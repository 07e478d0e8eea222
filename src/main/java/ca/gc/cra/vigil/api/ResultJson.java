package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.application.batch.BatchSummary;
import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Renders validation results as single-line JSON objects for {@code --json} output.
 *
 * <pre>
 * {"type":"iban","valid":true,"normalizedValue":"GB82WEST12345698765432"}
 * {"type":"iban","line":3,"valid":false,"errorMessage":"Invalid IBAN checksum"}
 * </pre>
 *
 * @since 0.1.0
 */
final class ResultJson {
  private static final JsonFactory FACTORY = new JsonFactory();

  private ResultJson() {}

  static String render(InputType type, ValidationResult result) {
    return render(type, -1, result);
  }

  static String render(InputType type, long lineNumber, ValidationResult result) {
    return write(generator -> {
      generator.writeStartObject();
      generator.writeStringField("type", type.tag());
      if (lineNumber > 0) {
        generator.writeNumberField("line", lineNumber);
      }
      generator.writeBooleanField("valid", result.valid());
      if (result.valid()) {
        if (result.normalizedValue() != null) {
          generator.writeFieldName("normalizedValue");
          writeValue(generator, result.normalizedValue());
        }
      } else {
        generator.writeStringField("errorMessage", result.errorMessage());
      }
      generator.writeEndObject();
    });
  }

  static String render(BatchSummary summary) {
    return write(generator -> {
      generator.writeStartObject();
      generator.writeObjectFieldStart("summary");
      generator.writeNumberField("total", summary.total());
      generator.writeNumberField("valid", summary.valid());
      generator.writeNumberField("invalid", summary.invalid());
      generator.writeNumberField("skipped", summary.skipped());
      generator.writeEndObject();
      generator.writeEndObject();
    });
  }

  private static void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value instanceof Integer || value instanceof Long) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger bigInteger) {
      generator.writeNumber(bigInteger);
    } else if (value instanceof Number number && Double.isFinite(number.doubleValue())) {
      generator.writeNumber(new BigDecimal(ValueFormat.render(number)));
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else {
      generator.writeString(ValueFormat.render(value));
    }
  }

  private static String write(JsonWriter body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      body.write(generator);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON result", ex);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface JsonWriter {
    void write(JsonGenerator generator) throws IOException;
  }
}
