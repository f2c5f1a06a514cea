package com.vpnbot.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class RequestIdsTest {

  @Test
  void resolveKeepsWellFormedHeaderValue() {
    assertThat(RequestIds.resolve(" req-123.abc ")).isEqualTo("req-123.abc");
  }

  @Test
  void resolveGeneratesIdWhenHeaderMissingOrUnsafe() {
    assertThat(UUID.fromString(RequestIds.resolve(null))).isNotNull();
    assertThat(UUID.fromString(RequestIds.resolve("  "))).isNotNull();
    assertThat(UUID.fromString(RequestIds.resolve("bad id\nwith newline"))).isNotNull();
    assertThat(UUID.fromString(RequestIds.resolve("x".repeat(65)))).isNotNull();
  }
}
