package com.campusevents.checkin.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.campusevents.checkin.model.CheckInOutcome;
import com.campusevents.checkin.model.CheckInReason;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AuditHasherTest {

  private static final UUID RECORD_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
  private static final UUID REGISTRATION_ID =
      UUID.fromString("22222222-2222-2222-2222-222222222222");
  private static final Instant OCCURRED_AT = Instant.parse("2026-04-01T09:00:00.123456Z");

  private final AuditHasher hasher = new AuditHasher(new ObjectMapper());

  @Test
  void hashIsStableLowercaseSha256() {
    final String first = hash(null, "gate-a");
    final String second = hash(null, "gate-a");

    assertThat(first).isEqualTo(second).matches("[0-9a-f]{64}");
  }

  @Test
  void hashDependsOnPreviousLinkAndFields() {
    final String base = hash(null, "gate-a");

    assertThat(hash("0".repeat(64), "gate-a")).isNotEqualTo(base);
    assertThat(hash(null, "gate-b")).isNotEqualTo(base);
  }

  @Test
  void artifactDigestMatchesKnownSha256() {
    assertThat(hasher.digestArtifact(""))
        .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    assertThat(hasher.digestArtifact(null)).isEqualTo(hasher.digestArtifact(""));
  }

  private String hash(String prevHash, String deviceId) {
    return hasher.hashRecord(
        prevHash,
        RECORD_ID,
        REGISTRATION_ID,
        CheckInOutcome.INVALID,
        CheckInReason.VERIFICATION_MISMATCH,
        deviceId,
        "a".repeat(64),
        OCCURRED_AT);
  }
}
