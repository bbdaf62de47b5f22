package io.xk6.prometheus.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OptionsParserTest {

  @Test
  void parsesPortNamespaceAndSubsystem() {
    ExporterOptions options = OptionsParser.parse("port=9090&namespace=k6&subsystem=run");

    assertEquals(9090, options.port());
    assertEquals("", options.host());
    assertEquals("k6", options.namespace());
    assertEquals("run", options.subsystem());
    assertEquals(ExporterOptions.DEFAULT_BUCKETS, options.buckets());
  }

  @Test
  void emptyStringYieldsDefaults() {
    assertEquals(ExporterOptions.defaults(), OptionsParser.parse(""));
    assertEquals(ExporterOptions.defaults(), OptionsParser.parse(null));
    assertEquals(5656, OptionsParser.parse("  ").port());
  }

  @Test
  void hostAndEncodedValuesAreDecoded() {
    ExporterOptions options = OptionsParser.parse("host=127.0.0.1&namespace=load%5Ftest");

    assertEquals("127.0.0.1", options.host());
    assertEquals("load_test", options.namespace());
    assertEquals("127.0.0.1:5656", options.address());
  }

  @Test
  void keysAreCaseInsensitiveAndLastValueWins() {
    ExporterOptions options = OptionsParser.parse("PORT=1000&Port=2000&NameSpace=k6");

    assertEquals(2000, options.port());
    assertEquals("k6", options.namespace());
  }

  @Test
  void unknownKeyIsRejected() {
    ExporterConfigException ex =
        assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("port=9090&prefix=k6"));

    assertTrue(ex.getMessage().contains("prefix"));
  }

  @Test
  void malformedEncodingIsRejected() {
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("namespace=%zz"));
  }

  @Test
  void semicolonSeparatorIsRejected() {
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("port=9090;namespace=k6"));
  }

  @Test
  void invalidPortsAreRejected() {
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("port=abc"));
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("port=65536"));
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("port=-1"));
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("port="));
  }

  @Test
  void portZeroMeansEphemeral() {
    assertEquals(0, OptionsParser.parse("port=0").port());
  }

  @Test
  void blankKeyIsRejected() {
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("=9090"));
  }

  @Test
  void bucketsMustBeStrictlyIncreasingFiniteNumbers() {
    assertEquals(List.of(0.5, 1.0, 10.0), OptionsParser.parse("buckets=0.5,1,10").buckets());
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parseBuckets("1,1"));
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parseBuckets("5,1"));
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parseBuckets("1,NaN"));
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parseBuckets("1,x"));
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parseBuckets(""));
  }

  @Test
  void fromMapMatchesKeysCaseInsensitively() {
    ExporterOptions options = OptionsParser.fromMap(Map.of("Subsystem", "api"));

    assertEquals("api", options.subsystem());
  }

  @Test
  void controlCharactersInValuesAreRejected() {
    assertThrows(ExporterConfigException.class, () -> OptionsParser.parse("namespace=k6%01"));
  }
}
