/*
 * どこで: Check-in サービス層
 * 何を: スキャン受付の入口。ストレージ障害を 503 相当の例外へ変換し、メトリクスとログを残す
 * なぜ: 台帳が判定できないときに受理扱いにせず、必ず拒否として返すため
 */
package com.campusevents.checkin.service;

import com.campusevents.checkin.api.StorageUnavailableException;

import lombok.RequiredArgsConstructor;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

@Service
@RequiredArgsConstructor
public class CheckInService {

    private static final Logger logger = LoggerFactory.getLogger(CheckInService.class);

    // check_in_records.device_id の列幅
    static final int MAX_DEVICE_ID_LENGTH = 128;

    private final CheckInProtocol protocol;
    private final CheckInMetrics metrics;

    public CheckInResult attemptCheckIn(String artifact, String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("device_id is required");
        }
        if (deviceId.length() > MAX_DEVICE_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "device_id must be at most " + MAX_DEVICE_ID_LENGTH + " characters");
        }
        long startedAt = System.nanoTime();
        try {
            CheckInResult result = protocol.attempt(artifact, deviceId);
            metrics.recordScan(result.outcome().name());
            logger.info("check-in scanned outcome={} reason={} device_id={} record_id={}",
                    result.outcome(), result.reason(), deviceId, result.recordId());
            return result;
        } catch (DataAccessException | TransactionException ex) {
            metrics.recordScan(CheckInMetrics.OUTCOME_STORAGE_UNAVAILABLE);
            logger.error("check-in ledger unavailable; scan rejected device_id={}", deviceId, ex);
            throw new StorageUnavailableException("check-in ledger unavailable; scan rejected", ex);
        } finally {
            metrics.recordScanDuration(Duration.ofNanos(System.nanoTime() - startedAt));
        }
    }
}
