/*
 * どこで: Check-in サービス層
 * 何を: スキャン 1 回を 1 トランザクションで判定し、結果を 1 行追記する
 * なぜ: 登録行ロックと compare-and-set で、同時スキャンでも受理を高々 1 回に制限するため
 */
package com.campusevents.checkin.service;

import com.campusevents.checkin.codec.DecodedToken;
import com.campusevents.checkin.codec.InvalidTokenFormatException;
import com.campusevents.checkin.codec.TokenCodec;
import com.campusevents.checkin.model.CheckInOutcome;
import com.campusevents.checkin.model.CheckInReason;
import com.campusevents.checkin.model.CheckInRecord;
import com.campusevents.checkin.model.RegistrationRecord;
import com.campusevents.checkin.model.RegistrationState;
import com.campusevents.checkin.repository.CheckInRecordRepository;
import com.campusevents.checkin.repository.RegistrationRepository;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class CheckInProtocol {

    private static final Logger logger = LoggerFactory.getLogger(CheckInProtocol.class);

    private final TokenCodec tokenCodec;
    private final RegistrationRepository registrationRepository;
    private final CheckInRecordRepository recordRepository;
    private final AuditHasher auditHasher;
    private final Clock clock;

    @Transactional
    public CheckInResult attempt(String artifact, String deviceId) {
        Instant now = Instant.now(clock);
        String artifactDigest = auditHasher.digestArtifact(artifact);
        DecodedToken token;
        try {
            token = tokenCodec.decode(artifact);
        } catch (InvalidTokenFormatException ex) {
            logger.debug("malformed artifact rejected: {}", ex.getMessage());
            return reject(null, CheckInReason.MALFORMED_ARTIFACT, deviceId, artifactDigest, now);
        }
        // 同一登録へのスキャンはこの行ロックで直列化される
        Optional<RegistrationRecord> locked = registrationRepository.lockById(token.registrationId());
        if (locked.isEmpty()) {
            return reject(null, CheckInReason.UNKNOWN_REGISTRATION, deviceId, artifactDigest, now);
        }
        RegistrationRecord registration = locked.get();
        if (!tokenCodec.verify(token, registration.tokenSecret())) {
            logger.warn("verification mismatch registration_id={}", registration.registrationId());
            return reject(registration, CheckInReason.VERIFICATION_MISMATCH, deviceId, artifactDigest, now);
        }
        return transition(registration, deviceId, artifactDigest, now);
    }

    private CheckInResult transition(
            RegistrationRecord registration, String deviceId, String artifactDigest, Instant now) {
        return switch (registration.state()) {
            case VOID -> {
                CheckInRecord record = append(registration.registrationId(), CheckInOutcome.INVALID,
                        CheckInReason.REGISTRATION_VOIDED, deviceId, artifactDigest, now);
                yield new CheckInResult(CheckInOutcome.INVALID, CheckInReason.REGISTRATION_VOIDED,
                        registration, null, record.recordId());
            }
            case CHECKED_IN -> {
                CheckInRecord record = append(registration.registrationId(), CheckInOutcome.DUPLICATE,
                        null, deviceId, artifactDigest, now);
                yield new CheckInResult(CheckInOutcome.DUPLICATE, null,
                        registration, registration.checkedInAt(), record.recordId());
            }
            case ISSUED -> admit(registration, deviceId, artifactDigest, now);
        };
    }

    private CheckInResult admit(
            RegistrationRecord registration, String deviceId, String artifactDigest, Instant now) {
        if (registration.isCheckInClosed(now)) {
            CheckInRecord record = append(registration.registrationId(), CheckInOutcome.EXPIRED,
                    CheckInReason.CHECK_IN_CLOSED, deviceId, artifactDigest, now);
            return new CheckInResult(CheckInOutcome.EXPIRED, CheckInReason.CHECK_IN_CLOSED,
                    registration, null, record.recordId());
        }
        Optional<RegistrationRecord> updated = registrationRepository.markCheckedIn(
                registration.registrationId(), RegistrationState.ISSUED, now);
        if (updated.isEmpty()) {
            RegistrationRecord current = registrationRepository.findById(registration.registrationId())
                    .orElseThrow(() -> new IllegalStateException(
                            "registration disappeared during check-in: " + registration.registrationId()));
            if (current.state() == RegistrationState.ISSUED) {
                throw new IllegalStateException(
                        "check-in compare-and-set failed for ISSUED registration " + current.registrationId());
            }
            return transition(current, deviceId, artifactDigest, now);
        }
        // 受理レコードと checked_in_at は同じ時刻を使う
        CheckInRecord record = append(registration.registrationId(), CheckInOutcome.ACCEPTED,
                null, deviceId, artifactDigest, now);
        return new CheckInResult(CheckInOutcome.ACCEPTED, null, updated.get(), now, record.recordId());
    }

    private CheckInResult reject(
            RegistrationRecord registration,
            CheckInReason reason,
            String deviceId,
            String artifactDigest,
            Instant now) {
        UUID registrationId = registration == null ? null : registration.registrationId();
        CheckInRecord record = append(registrationId, CheckInOutcome.INVALID, reason, deviceId, artifactDigest, now);
        // 署名不一致では登録内容を呼び出し側へ返さない
        return new CheckInResult(CheckInOutcome.INVALID, reason, null, null, record.recordId());
    }

    private CheckInRecord append(
            UUID registrationId,
            CheckInOutcome outcome,
            CheckInReason reason,
            String deviceId,
            String artifactDigest,
            Instant now) {
        String prevHash = registrationId == null
                ? null
                : recordRepository.findLatestHash(registrationId).orElse(null);
        UUID recordId = UUID.randomUUID();
        String recordHash = auditHasher.hashRecord(
                prevHash, recordId, registrationId, outcome, reason, deviceId, artifactDigest, now);
        return recordRepository.append(new CheckInRecord(
                recordId, 0L, registrationId, outcome, reason, deviceId, artifactDigest, now, prevHash, recordHash));
    }
}
