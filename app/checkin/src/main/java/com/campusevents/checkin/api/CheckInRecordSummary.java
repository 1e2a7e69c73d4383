package com.campusevents.checkin.api;

import com.campusevents.checkin.model.CheckInRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckInRecordSummary(
    UUID recordId,
    long recordSeq,
    String outcome,
    String reason,
    String deviceId,
    String artifactDigest,
    Instant occurredAt,
    String prevHash,
    String recordHash) {

  public static CheckInRecordSummary from(CheckInRecord record) {
    return new CheckInRecordSummary(
        record.recordId(),
        record.recordSeq(),
        record.outcome().name(),
        record.reason() == null ? null : record.reason().name(),
        record.deviceId(),
        record.artifactDigest(),
        record.occurredAt(),
        record.prevHash(),
        record.recordHash());
  }
}
