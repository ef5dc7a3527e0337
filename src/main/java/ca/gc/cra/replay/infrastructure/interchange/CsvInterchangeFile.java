package ca.gc.cra.replay.infrastructure.interchange;

import ca.gc.cra.replay.application.port.InterchangeFilePort;
import ca.gc.cra.replay.domain.replay.Sample;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> RFC 4180 CSV implementation of the interchange file.
 * <p><strong>Format:</strong> header {@code timestamp,key,type,value,meta}; one sample per row; timestamps in
 * seconds with six decimals. Fields containing commas, quotes, or line breaks are quoted.</p>
 * <p><strong>Reading:</strong> rows with fewer than four columns or an unparsable timestamp (including the
 * header) are skipped; a missing {@code meta} column yields empty metadata.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use on distinct files.</p>
 *
 * @since 0.1.0
 */
public final class CsvInterchangeFile implements InterchangeFilePort {
  private static final Logger log = LoggerFactory.getLogger(CsvInterchangeFile.class);
  static final List<String> HEADER = List.of("timestamp", "key", "type", "value", "meta");
  private static final String LINE_END = "\r\n";

  @Override
  public List<Sample> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    }
  }

  /**
   * Reads samples from an open reader.
   *
   * @param reader CSV source; not closed
   * @return parsed samples in file order
   * @throws IOException when reading fails
   */
  public List<Sample> read(Reader reader) throws IOException {
    CsvRowReader rows = new CsvRowReader(reader);
    List<Sample> samples = new ArrayList<>();
    long skipped = 0;
    List<String> row;
    while ((row = rows.next()) != null) {
      Sample sample = toSample(row);
      if (sample == null) {
        skipped++;
      } else {
        samples.add(sample);
      }
    }
    if (skipped > 1) {
      log.debug("Skipped {} interchange rows without a usable timestamp", skipped);
    }
    return samples;
  }

  @Override
  public void write(Path path, List<Sample> samples) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(samples, "samples");
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(writer, samples);
    }
  }

  /**
   * Writes samples with a header row.
   *
   * @param writer destination; flushed but not closed
   * @param samples samples in output order
   * @throws IOException when writing fails
   */
  public void write(Writer writer, List<Sample> samples) throws IOException {
    writeRow(writer, HEADER);
    for (Sample sample : samples) {
      writeRow(writer, List.of(
          String.format(Locale.ROOT, "%.6f", sample.timestampSeconds()),
          sample.key(),
          sample.typeName(),
          sample.value(),
          sample.metadata()));
    }
    writer.flush();
  }

  private static Sample toSample(List<String> row) {
    if (row.size() < 4) {
      return null;
    }
    double timestamp;
    try {
      timestamp = Double.parseDouble(row.get(0).trim());
    } catch (NumberFormatException ex) {
      return null;
    }
    String metadata = row.size() >= 5 ? row.get(4) : "";
    return new Sample(timestamp, row.get(1), row.get(2), row.get(3), metadata);
  }

  private static void writeRow(Writer writer, List<String> fields) throws IOException {
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        writer.write(',');
      }
      writer.write(quote(fields.get(i)));
    }
    writer.write(LINE_END);
  }

  static String quote(String field) {
    if (field == null) {
      return "";
    }
    boolean needsQuotes = false;
    for (int i = 0; i < field.length() && !needsQuotes; i++) {
      char c = field.charAt(i);
      needsQuotes = c == ',' || c == '"' || c == '\r' || c == '\n';
    }
    if (!needsQuotes) {
      return field;
    }
    return '"' + field.replace("\"", "\"\"") + '"';
  }
}
