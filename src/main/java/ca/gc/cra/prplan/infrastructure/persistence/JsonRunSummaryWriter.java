package ca.gc.cra.prplan.infrastructure.persistence;

import ca.gc.cra.prplan.application.port.RunSummaryPort;
import ca.gc.cra.prplan.domain.plan.RunSummary;
import ca.gc.cra.prplan.domain.plan.RunSummary.GroupSummary;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes {@code run-summary.json} with Jackson's streaming generator.
 * <p>Field names are stable; consumers read {@code groups[].succeeded} to decide whether the report is complete.</p>
 *
 * @since 0.1.0
 */
public final class JsonRunSummaryWriter implements RunSummaryPort {
  /** File name written inside the output directory. */
  public static final String FILE_NAME = "run-summary.json";
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();

  /** Creates a writer. */
  public JsonRunSummaryWriter() {}

  @Override
  public Path write(RunSummary summary) throws IOException {
    Objects.requireNonNull(summary, "summary");
    Path directory = summary.outputDirectory();
    Files.createDirectories(directory);
    Path file = directory.resolve(FILE_NAME);
    try (JsonGenerator gen = jsonFactory.createGenerator(file.toFile(), JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("module", summary.moduleName());
      gen.writeStringField("requestedMode", summary.requestedMode().name());
      gen.writeStringField("effectiveMode", summary.effectiveMode().name());
      gen.writeStringField("outputDirectory", summary.outputDirectory().toString());
      gen.writeStringField("startedAt", Instant.ofEpochMilli(summary.startedAtMillis()).toString());
      gen.writeStringField("finishedAt", Instant.ofEpochMilli(summary.finishedAtMillis()).toString());
      gen.writeNumberField("durationMillis", summary.finishedAtMillis() - summary.startedAtMillis());
      gen.writeBooleanField("succeeded", summary.succeeded());
      gen.writeArrayFieldStart("groups");
      for (GroupSummary group : summary.groups()) {
        writeGroup(gen, group);
      }
      gen.writeEndArray();
      gen.writeNumberField("recordCount", summary.recordCount());
      gen.writeNumberField("environmentCount", summary.environmentCount());
      writeOptional(gen, "report", summary.report().map(Path::toString));
      gen.writeEndObject();
    }
    return file;
  }

  private static void writeGroup(JsonGenerator gen, GroupSummary group) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("accountClass", group.accountClass().name());
    gen.writeStringField("artifact", group.accountClass().artifactFileName());
    gen.writeNumberField("targets", group.targets());
    gen.writeNumberField("invocations", group.invocations());
    gen.writeBooleanField("succeeded", group.succeeded());
    gen.writeBooleanField("noWork", group.noWork());
    writeOptional(gen, "failedTarget", group.failedTarget());
    writeOptional(gen, "error", group.error());
    gen.writeEndObject();
  }

  private static void writeOptional(JsonGenerator gen, String field, Optional<String> value)
      throws IOException {
    if (value.isPresent()) {
      gen.writeStringField(field, value.get());
    } else {
      gen.writeNullField(field);
    }
  }
}
