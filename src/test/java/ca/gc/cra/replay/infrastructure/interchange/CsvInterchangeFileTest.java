package ca.gc.cra.replay.infrastructure.interchange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.replay.domain.replay.Sample;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvInterchangeFileTest {
  private final CsvInterchangeFile file = new CsvInterchangeFile();

  @Test
  void writesHeaderAndSixDecimalTimestamps() throws IOException {
    StringWriter out = new StringWriter();
    file.write(out, List.of(new Sample(1.5, "/drive/speed", "double", "3.25", "")));

    assertEquals(
        "timestamp,key,type,value,meta\r\n1.500000,/drive/speed,double,3.25,\r\n",
        out.toString());
  }

  @Test
  void quotesFieldsWithSeparatorsAndQuotes() throws IOException {
    StringWriter out = new StringWriter();
    file.write(out, List.of(new Sample(0.02, "/arm/angles", "double[]", "1.0,2.0", "{\"unit\":\"deg\"}")));

    String[] lines = out.toString().split("\r\n");
    assertEquals("0.020000,/arm/angles,double[],\"1.0,2.0\",\"{\"\"unit\"\":\"\"deg\"\"}\"", lines[1]);
  }

  @Test
  void quoteLeavesPlainFieldsAlone() {
    assertEquals("plain", CsvInterchangeFile.quote("plain"));
    assertEquals("", CsvInterchangeFile.quote(null));
    assertEquals("\"two\nlines\"", CsvInterchangeFile.quote("two\nlines"));
  }

  @Test
  void readSkipsHeaderAndRowsWithoutTimestamp() throws IOException {
    String csv = "timestamp,key,type,value,meta\n"
        + "0.5,/a,boolean,true,\n"
        + "not-a-number,/b,double,1.0,\n"
        + "1.0,/c,string\n"
        + "\n"
        + "2.0,/d,int64,7\n";

    List<Sample> samples = file.read(new StringReader(csv));

    assertEquals(2, samples.size());
    assertEquals(new Sample(0.5, "/a", "boolean", "true", ""), samples.get(0));
    Sample missingMeta = samples.get(1);
    assertEquals("/d", missingMeta.key());
    assertEquals("", missingMeta.metadata());
  }

  @Test
  void readHandlesQuotedFieldsSpanningLines() throws IOException {
    String csv = "timestamp,key,type,value,meta\r\n"
        + "0.1,/log,string,\"first\r\nsecond\",\"a \"\"quoted\"\" note\"\r\n";

    List<Sample> samples = file.read(new StringReader(csv));

    assertEquals(1, samples.size());
    assertEquals("first\r\nsecond", samples.get(0).value());
    assertEquals("a \"quoted\" note", samples.get(0).metadata());
  }

  @Test
  void fileRoundTripPreservesOrderAndContent(@TempDir Path dir) throws IOException {
    Path path = dir.resolve("match.csv");
    List<Sample> samples = List.of(
        new Sample(0.04, "/b", "string", "hello, world", "src=\"dash\""),
        new Sample(0.0, "/a", "int64", "42", ""));

    file.write(path, samples);
    List<Sample> reread = file.read(path);

    assertTrue(Files.readString(path).startsWith("timestamp,key,type,value,meta\r\n"));
    assertEquals(samples, reread);
  }
}
