package ca.gc.cra.replay.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RawTypeTagsTest {
  @Test
  void metadataTypeFieldWins() {
    assertEquals("photonvision", RawTypeTags.resolve("struct:Pose2d", "{\"source\":1,\"type\":\"photonvision\"}"));
  }

  @Test
  void nestedObjectsAreSkippedWhileSearching() {
    assertEquals("rev", RawTypeTags.resolve("raw", "{\"inner\":{\"type\":\"ignored\"},\"type\":\"rev\"}"));
  }

  @Test
  void customTypeNameUsedWithoutMetadata() {
    assertEquals("struct:Pose2d", RawTypeTags.resolve("struct:Pose2d", ""));
    assertEquals("msgpack", RawTypeTags.resolve(" msgpack ", "not json"));
  }

  @Test
  void fallsBackToRaw() {
    assertEquals(RawTypeTags.FALLBACK, RawTypeTags.resolve("raw", "{\"type\":\"  \"}"));
    assertEquals(RawTypeTags.FALLBACK, RawTypeTags.resolve(null, null));
    assertEquals(RawTypeTags.FALLBACK, RawTypeTags.resolve("", "{\"type\":42}"));
  }

  @Test
  void typeFieldIgnoresNonObjects() {
    assertTrue(RawTypeTags.typeField("[\"type\"]").isEmpty());
    assertTrue(RawTypeTags.typeField("{\"type\":").isEmpty());
  }
}
