package ca.gc.cra.vantage.infrastructure.persistence;

import ca.gc.cra.vantage.application.port.SegmentPlanSink;
import ca.gc.cra.vantage.domain.agent.AgentSegments;
import ca.gc.cra.vantage.domain.agent.SegmentPlan;
import ca.gc.cra.vantage.domain.segment.SegmentView;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SegmentPlanSink} writing each plan as a JSON document.
 * <p><strong>Targets:</strong> With a file target the latest plan replaces the file through a sibling temp file
 * and a move, so readers never see a partial document. With a stream target (stdout) each plan is written as one
 * line.</p>
 * <p><strong>Thread-safety:</strong> {@link #publish(SegmentPlan)} is synchronized.</p>
 *
 * @since 0.1.0
 */
public final class JsonSegmentPlanWriter implements SegmentPlanSink {
  private static final Logger log = LoggerFactory.getLogger(JsonSegmentPlanWriter.class);

  private final JsonFactory jsonFactory = new JsonFactory();
  private final Path file;
  private final OutputStream stream;

  private JsonSegmentPlanWriter(Path file, OutputStream stream) {
    this.file = file;
    this.stream = stream;
  }

  /**
   * Creates a writer for an {@code out} configuration value.
   *
   * @param out file path, or {@code "-"}/blank/{@code null} for stdout
   * @return writer bound to the target
   */
  public static JsonSegmentPlanWriter forTarget(String out) {
    if (out == null || out.isBlank() || "-".equals(out.trim())) {
      return toStream(System.out);
    }
    return toFile(Path.of(out.trim()));
  }

  /**
   * @param file file replaced with the latest plan on every publish
   * @return file-backed writer
   */
  public static JsonSegmentPlanWriter toFile(Path file) {
    return new JsonSegmentPlanWriter(Objects.requireNonNull(file, "file").toAbsolutePath(), null);
  }

  /**
   * @param stream stream receiving one line per plan; never closed by this writer
   * @return stream-backed writer
   */
  public static JsonSegmentPlanWriter toStream(OutputStream stream) {
    return new JsonSegmentPlanWriter(null, Objects.requireNonNull(stream, "stream"));
  }

  @Override
  public synchronized void publish(SegmentPlan plan) throws IOException {
    Objects.requireNonNull(plan, "plan");
    if (file == null) {
      write(plan, stream);
      stream.write('\n');
      stream.flush();
      return;
    }
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(tmp)) {
        write(plan, out);
      }
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
    log.debug("Wrote segment plan cycle {} to {}", plan.cycle(), file);
  }

  private void write(SegmentPlan plan, OutputStream out) throws IOException {
    JsonGenerator gen = jsonFactory.createGenerator(out);
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    try (gen) {
      gen.writeStartObject();
      gen.writeNumberField("cycle", plan.cycle());
      gen.writeNumberField("generatedAt", plan.generatedAtMillis());
      gen.writeArrayFieldStart("agents");
      for (AgentSegments agent : plan.agents()) {
        gen.writeStartObject();
        gen.writeStringField("name", agent.agentName());
        writeSegments(gen, "localSegments", agent.localSegments());
        writeSegments(gen, "remoteSegments", agent.remoteSegments());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      writeSegments(gen, "notYetClaimed", plan.notYetClaimed());
      gen.writeEndObject();
    }
  }

  private static void writeSegments(JsonGenerator gen, String field, List<SegmentView> segments)
      throws IOException {
    gen.writeArrayFieldStart(field);
    for (SegmentView segment : segments) {
      gen.writeStartObject();
      gen.writeNumberField("id", segment.id());
      gen.writeArrayFieldStart("mac");
      for (String mac : segment.macs()) {
        gen.writeString(mac);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("interfaceId");
      for (Integer id : segment.interfaceIds()) {
        gen.writeNumber(id);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }
}
