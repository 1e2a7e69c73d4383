/*
 * どこで: Check-in サービス層
 * 何を: 登録ごとのスキャン記録を順序どおり返し、ハッシュ連鎖を再計算して検証する
 * なぜ: 受理/拒否の紛争時に、記録が追記後に変更されていないことを示すため
 */
package com.campusevents.checkin.service;

import com.campusevents.checkin.api.RegistrationNotFoundException;
import com.campusevents.checkin.model.CheckInRecord;
import com.campusevents.checkin.repository.CheckInRecordRepository;
import com.campusevents.checkin.repository.RegistrationRepository;

import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CheckInAuditService {

    private static final Logger logger = LoggerFactory.getLogger(CheckInAuditService.class);

    private final RegistrationRepository registrationRepository;
    private final CheckInRecordRepository recordRepository;
    private final AuditHasher auditHasher;

    public CheckInAuditTrail trail(UUID registrationId) {
        if (registrationRepository.findById(registrationId).isEmpty()) {
            throw new RegistrationNotFoundException("registration not found: " + registrationId);
        }
        List<CheckInRecord> records = recordRepository.findByRegistrationId(registrationId);
        UUID brokenRecordId = findFirstBrokenLink(records);
        if (brokenRecordId != null) {
            logger.error("check-in audit chain broken registration_id={} record_id={}",
                    registrationId, brokenRecordId);
        }
        return new CheckInAuditTrail(registrationId, records, brokenRecordId == null, brokenRecordId);
    }

    UUID findFirstBrokenLink(List<CheckInRecord> records) {
        String expectedPrev = null;
        for (CheckInRecord record : records) {
            if (!Objects.equals(record.prevHash(), expectedPrev)) {
                return record.recordId();
            }
            String recomputed = auditHasher.hashRecord(
                    record.prevHash(),
                    record.recordId(),
                    record.registrationId(),
                    record.outcome(),
                    record.reason(),
                    record.deviceId(),
                    record.artifactDigest(),
                    record.occurredAt());
            if (!recomputed.equals(record.recordHash())) {
                return record.recordId();
            }
            expectedPrev = record.recordHash();
        }
        return null;
    }
}
