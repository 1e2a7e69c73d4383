/*
 * どこで: CheckInService のユニットテスト
 * 何を: ストレージ障害時に受理扱いせず StorageUnavailableException を返すことを検証する
 * なぜ: 台帳が判定できない状態でスキャンを通さないため
 */
package com.campusevents.checkin.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.campusevents.checkin.api.StorageUnavailableException;
import com.campusevents.checkin.model.CheckInOutcome;
import com.campusevents.checkin.model.CheckInReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

@ExtendWith(MockitoExtension.class)
class CheckInServiceFailClosedTest {

  @Mock private CheckInProtocol protocol;

  private SimpleMeterRegistry registry;
  private CheckInService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service = new CheckInService(protocol, new CheckInMetrics(registry));
  }

  @Test
  void dataAccessFailureIsReportedAsStorageUnavailable() {
    final DataAccessResourceFailureException cause =
        new DataAccessResourceFailureException("connection refused");
    when(protocol.attempt("CK1.a.b", "gate-a")).thenThrow(cause);

    assertThatThrownBy(() -> service.attemptCheckIn("CK1.a.b", "gate-a"))
        .isInstanceOf(StorageUnavailableException.class)
        .hasCause(cause);
    assertThat(
            registry.get("checkin.scan.total").tag("outcome", "STORAGE_UNAVAILABLE").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void transactionFailureIsReportedAsStorageUnavailable() {
    when(protocol.attempt("CK1.a.b", "gate-a"))
        .thenThrow(new CannotCreateTransactionException("pool exhausted"));

    assertThatThrownBy(() -> service.attemptCheckIn("CK1.a.b", "gate-a"))
        .isInstanceOf(StorageUnavailableException.class);
  }

  @Test
  void outcomeIsCountedWhenProtocolReturns() {
    when(protocol.attempt("garbage", "gate-a"))
        .thenReturn(
            new CheckInResult(
                CheckInOutcome.INVALID,
                CheckInReason.MALFORMED_ARTIFACT,
                null,
                null,
                UUID.randomUUID()));

    final CheckInResult result = service.attemptCheckIn("garbage", "gate-a");

    assertThat(result.outcome()).isEqualTo(CheckInOutcome.INVALID);
    assertThat(registry.get("checkin.scan.total").tag("outcome", "INVALID").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("checkin.scan.duration").timer().count()).isEqualTo(1L);
  }

  @Test
  void blankDeviceIsRejectedBeforeTouchingTheLedger() {
    assertThatThrownBy(() -> service.attemptCheckIn("CK1.a.b", " "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("device_id is required");
    verifyNoInteractions(protocol);
  }

  @Test
  void overlongDeviceIsRejectedBeforeTouchingTheLedger() {
    assertThatThrownBy(() -> service.attemptCheckIn("CK1.a.b", "d".repeat(129)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("device_id must be at most 128 characters");
    verifyNoInteractions(protocol);
  }
}
