/*
 * どこで: CheckInAuditService の連鎖検証ユニットテスト
 * 何を: prev_hash の断絶と record_hash の不一致を検出することを検証する
 * なぜ: 追記後の改ざんを監査時に見逃さないため
 */
package com.campusevents.checkin.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.campusevents.checkin.model.CheckInOutcome;
import com.campusevents.checkin.model.CheckInReason;
import com.campusevents.checkin.model.CheckInRecord;
import com.campusevents.checkin.repository.CheckInRecordRepository;
import com.campusevents.checkin.repository.RegistrationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class CheckInAuditChainTest {

  private static final UUID REGISTRATION_ID =
      UUID.fromString("22222222-2222-2222-2222-222222222222");
  private static final Instant START = Instant.parse("2026-04-01T09:00:00Z");

  private final AuditHasher hasher = new AuditHasher(new ObjectMapper());
  private final CheckInAuditService service =
      new CheckInAuditService(
          mock(RegistrationRepository.class), mock(CheckInRecordRepository.class), hasher);

  @Test
  void intactChainHasNoBrokenLink() {
    assertThat(service.findFirstBrokenLink(chain())).isNull();
    assertThat(service.findFirstBrokenLink(List.of())).isNull();
  }

  @Test
  void alteredFieldIsDetected() {
    final List<CheckInRecord> records = new ArrayList<>(chain());
    final CheckInRecord original = records.get(1);
    records.set(
        1,
        new CheckInRecord(
            original.recordId(),
            original.recordSeq(),
            original.registrationId(),
            CheckInOutcome.ACCEPTED,
            null,
            original.deviceId(),
            original.artifactDigest(),
            original.occurredAt(),
            original.prevHash(),
            original.recordHash()));

    assertThat(service.findFirstBrokenLink(records)).isEqualTo(original.recordId());
  }

  @Test
  void removedRecordBreaksTheLink() {
    final List<CheckInRecord> records = new ArrayList<>(chain());
    records.remove(1);

    assertThat(service.findFirstBrokenLink(records)).isEqualTo(records.get(1).recordId());
  }

  private List<CheckInRecord> chain() {
    final List<CheckInRecord> records = new ArrayList<>();
    String prevHash = null;
    final CheckInOutcome[] outcomes = {
      CheckInOutcome.ACCEPTED, CheckInOutcome.DUPLICATE, CheckInOutcome.DUPLICATE
    };
    for (int i = 0; i < outcomes.length; i++) {
      final UUID recordId = UUID.randomUUID();
      final Instant occurredAt = START.plusSeconds(i * 60L);
      final CheckInReason reason = null;
      final String digest = hasher.digestArtifact("artifact-" + i);
      final String recordHash =
          hasher.hashRecord(
              prevHash, recordId, REGISTRATION_ID, outcomes[i], reason, "gate-a", digest, occurredAt);
      records.add(
          new CheckInRecord(
              recordId,
              i + 1L,
              REGISTRATION_ID,
              outcomes[i],
              reason,
              "gate-a",
              digest,
              occurredAt,
              prevHash,
              recordHash));
      prevHash = recordHash;
    }
    return records;
  }
}
