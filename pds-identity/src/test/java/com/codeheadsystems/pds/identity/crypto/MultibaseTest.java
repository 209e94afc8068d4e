package com.codeheadsystems.pds.identity.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class MultibaseTest {

  @Test
  void base58Encode_knownVector() {
    assertThat(Multibase.base58Encode("Hello World!".getBytes(StandardCharsets.US_ASCII)))
        .isEqualTo("2NEpo7TZRRrLZSi2U");
  }

  @Test
  void base58Encode_leadingZerosBecomeOnes() {
    assertThat(Multibase.base58Encode(new byte[]{0, 0, 1})).isEqualTo("112");
  }

  @Test
  void base58Encode_empty() {
    assertThat(Multibase.base58Encode(new byte[0])).isEmpty();
  }

  @Test
  void base58Decode_knownVector() {
    assertThat(Multibase.base58Decode("2NEpo7TZRRrLZSi2U"))
        .isEqualTo("Hello World!".getBytes(StandardCharsets.US_ASCII));
  }

  @Test
  void base58Decode_preservesLeadingZeros() {
    assertThat(Multibase.base58Decode("112")).isEqualTo(new byte[]{0, 0, 1});
    assertThat(Multibase.base58Decode("1")).isEqualTo(new byte[]{0});
  }

  @Test
  void base58Decode_highBitBytes() {
    byte[] input = {(byte) 0xff, (byte) 0x80, 0x00, 0x7f};
    assertThat(Multibase.base58Decode(Multibase.base58Encode(input))).isEqualTo(input);
  }

  @Test
  void base58Decode_invalidCharacter_throws() {
    assertThatThrownBy(() -> Multibase.base58Decode("0OIl"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid base58 character");
  }

  @Test
  void decodeBase58btc_requiresZPrefix() {
    assertThatThrownBy(() -> Multibase.decodeBase58btc("mAQID"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported multibase");
  }

  @Test
  void encodeBase58btc_addsZPrefix() {
    assertThat(Multibase.encodeBase58btc(new byte[]{0, 0, 1})).isEqualTo("z112");
  }
}
