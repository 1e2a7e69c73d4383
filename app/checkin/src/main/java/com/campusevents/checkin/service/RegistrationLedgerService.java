/*
 * どこで: Check-in サービス層
 * 何を: 登録の発行/参照/無効化と管理監査の追記を担う
 * なぜ: (subject, event) 一意性と状態遷移を DB 制約と同一トランザクションで保証するため
 */
package com.campusevents.checkin.service;

import com.campusevents.checkin.api.AlreadyCheckedInException;
import com.campusevents.checkin.api.ArtifactAccessDeniedException;
import com.campusevents.checkin.api.DuplicateRegistrationException;
import com.campusevents.checkin.api.RegistrationNotFoundException;
import com.campusevents.checkin.codec.TokenCodec;
import com.campusevents.checkin.model.RegistrationAuditRecord;
import com.campusevents.checkin.model.RegistrationRecord;
import com.campusevents.checkin.model.RegistrationState;
import com.campusevents.checkin.repository.RegistrationAuditRepository;
import com.campusevents.checkin.repository.RegistrationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class RegistrationLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationLedgerService.class);

    static final String ACTION_ISSUE = "ISSUE";
    static final String ACTION_VOID = "VOID";
    static final String ACTION_FORCE_VOID = "FORCE_VOID";
    static final String ACTION_REISSUE_ARTIFACT = "REISSUE_ARTIFACT";
    private static final String RESULT_SUCCESS = "success";
    private static final String RESULT_REJECTED = "rejected";
    private static final String MDC_REQUEST_ID = "request_id";
    // registrations / registration_audit の列幅
    static final int MAX_ID_LENGTH = 64;
    static final int MAX_REASON_LENGTH = 255;

    private final RegistrationRepository registrationRepository;
    private final RegistrationAuditRepository auditRepository;
    private final TokenCodec tokenCodec;
    private final CheckInMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public IssuedRegistration issue(String subjectId, String eventId, Instant checkInClosesAt) {
        requireText(subjectId, "subject_id", MAX_ID_LENGTH);
        requireText(eventId, "event_id", MAX_ID_LENGTH);
        Instant now = Instant.now(clock);
        Optional<RegistrationRecord> inserted = registrationRepository.insertIfAbsent(
                UUID.randomUUID(),
                subjectId,
                eventId,
                tokenCodec.newSecret(),
                now,
                checkInClosesAt);
        if (inserted.isEmpty()) {
            metrics.recordRegistration(ACTION_ISSUE, RESULT_REJECTED);
            throw new DuplicateRegistrationException(
                    "subject " + subjectId + " is already registered for event " + eventId);
        }
        RegistrationRecord registration = inserted.get();
        auditRepository.insert(buildAuditRecord(registration, ACTION_ISSUE, subjectId, null, now));
        metrics.recordRegistration(ACTION_ISSUE, RESULT_SUCCESS);
        logger.info("registration issued registration_id={} event_id={} issue_seq={}",
                registration.registrationId(), eventId, registration.issueSeq());
        return new IssuedRegistration(registration, renderArtifact(registration));
    }

    public RegistrationRecord get(UUID registrationId) {
        return registrationRepository.findById(registrationId)
                .orElseThrow(() -> notFound(registrationId));
    }

    public List<RegistrationRecord> listByEvent(String eventId) {
        requireText(eventId, "event_id", MAX_ID_LENGTH);
        return registrationRepository.findByEventId(eventId);
    }

    /**
     * 紛失したコードを再表示する。トークンは決定的なので、発行時と同じ文字列になる。
     */
    @Transactional
    public String artifact(UUID registrationId, String callerId, boolean callerIsAdmin) {
        requireText(callerId, "actor_id", MAX_ID_LENGTH);
        RegistrationRecord registration = get(registrationId);
        if (!callerIsAdmin && !registration.subjectId().equals(callerId)) {
            throw new ArtifactAccessDeniedException("artifact is only available to its owner");
        }
        auditRepository.insert(buildAuditRecord(
                registration, ACTION_REISSUE_ARTIFACT, callerId, null, Instant.now(clock)));
        metrics.recordRegistration(ACTION_REISSUE_ARTIFACT, RESULT_SUCCESS);
        return renderArtifact(registration);
    }

    @Transactional
    public RegistrationRecord voidRegistration(UUID registrationId, String actorId) {
        requireText(actorId, "actor_id", MAX_ID_LENGTH);
        Instant now = Instant.now(clock);
        Optional<RegistrationRecord> voided = registrationRepository.markVoidIfIssued(registrationId, now);
        if (voided.isPresent()) {
            auditRepository.insert(buildAuditRecord(voided.get(), ACTION_VOID, actorId, null, now));
            metrics.recordRegistration(ACTION_VOID, RESULT_SUCCESS);
            logger.info("registration voided registration_id={}", registrationId);
            return voided.get();
        }
        // CAS に負けた場合は現在状態で判定する
        RegistrationRecord current = get(registrationId);
        if (current.state() == RegistrationState.CHECKED_IN) {
            metrics.recordRegistration(ACTION_VOID, RESULT_REJECTED);
            throw new AlreadyCheckedInException(
                    "registration " + registrationId + " already checked in at " + current.checkedInAt());
        }
        if (current.state() == RegistrationState.VOID) {
            return current;
        }
        throw new IllegalStateException("void compare-and-set failed for ISSUED registration " + registrationId);
    }

    @Transactional
    public RegistrationRecord forceVoid(UUID registrationId, String actorId, String reason) {
        requireText(actorId, "actor_id", MAX_ID_LENGTH);
        requireText(reason, "reason", MAX_REASON_LENGTH);
        Instant now = Instant.now(clock);
        // 行ロックを取ってから読むので、previous_state と更新結果の間に受付が割り込まない
        Optional<RegistrationRecord> before = registrationRepository.lockById(registrationId);
        if (before.isEmpty()) {
            throw notFound(registrationId);
        }
        Optional<RegistrationRecord> voided = registrationRepository.forceVoid(registrationId, now);
        if (voided.isEmpty()) {
            return get(registrationId);
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("previous_state", before.get().state().name());
        detail.put("checked_in_at", voided.get().checkedInAt() == null ? null : voided.get().checkedInAt().toString());
        auditRepository.insert(buildAuditRecord(voided.get(), ACTION_FORCE_VOID, actorId, reason, now, detail));
        metrics.recordRegistration(ACTION_FORCE_VOID, RESULT_SUCCESS);
        logger.warn("registration force-voided registration_id={} previous_state={} actor_id={}",
                registrationId, before.get().state(), actorId);
        return voided.get();
    }

    private String renderArtifact(RegistrationRecord registration) {
        return tokenCodec.encode(registration.registrationId(), registration.tokenSecret());
    }

    private RegistrationAuditRecord buildAuditRecord(
            RegistrationRecord registration,
            String action,
            String actorId,
            String reason,
            Instant now) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("state", registration.state().name());
        detail.put("event_id", registration.eventId());
        return buildAuditRecord(registration, action, actorId, reason, now, detail);
    }

    private RegistrationAuditRecord buildAuditRecord(
            RegistrationRecord registration,
            String action,
            String actorId,
            String reason,
            Instant now,
            Map<String, Object> detail) {
        return new RegistrationAuditRecord(
                UUID.randomUUID(),
                now,
                registration.registrationId(),
                action,
                actorId,
                reason,
                MDC.get(MDC_REQUEST_ID),
                toJson(detail));
    }

    private String toJson(Map<String, Object> detail) {
        try {
            return objectMapper.writeValueAsString(detail);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize audit detail", ex);
        }
    }

    private static RegistrationNotFoundException notFound(UUID registrationId) {
        return new RegistrationNotFoundException("registration not found: " + registrationId);
    }

    private static void requireText(String value, String name, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(name + " must be at most " + maxLength + " characters");
        }
    }
}
