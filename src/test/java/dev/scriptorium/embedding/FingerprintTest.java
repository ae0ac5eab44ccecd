package dev.scriptorium.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FingerprintTest {

  @Test
  void fingerprintOfKnownInputMatchesSha256() {
    assertThat(Fingerprint.of("hello"))
        .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
  }

  @Test
  void surroundingWhitespaceIsIgnored() {
    assertThat(Fingerprint.of("  hello \n")).isEqualTo(Fingerprint.of("hello"));
  }

  @Test
  void caseIsPreserved() {
    assertThat(Fingerprint.of("Hello World ")).isNotEqualTo(Fingerprint.of("hello world"));
  }

  @Test
  void emptyStringProducesValidFingerprint() {
    assertThat(Fingerprint.of(""))
        .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
  }

  @Test
  void rawBytesRoundTripThroughHex() {
    String fingerprint = Fingerprint.of("bytes");

    assertThat(Fingerprint.toBytes(fingerprint)).hasSize(Fingerprint.BYTES);
  }
}
