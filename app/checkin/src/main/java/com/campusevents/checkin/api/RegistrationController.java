/*
 * どこで: Check-in API
 * 何を: 登録の発行/参照/コード再表示/無効化のエンドポイントを提供する
 * なぜ: 台帳操作の公開インターフェースを明確にするため
 */
package com.campusevents.checkin.api;

import com.campusevents.checkin.config.GatewayRoles;
import com.campusevents.checkin.service.CheckInAuditService;
import com.campusevents.checkin.service.CheckInAuditTrail;
import com.campusevents.checkin.service.IssuedRegistration;
import com.campusevents.checkin.service.RegistrationLedgerService;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class RegistrationController {

    static final String HEADER_USER_ID = "X-User-Id";
    static final String HEADER_USER_ROLES = "X-User-Roles";

    private final RegistrationLedgerService ledgerService;
    private final CheckInAuditService auditService;

    @PostMapping("/events/{event_id}/registrations")
    public ResponseEntity<RegistrationResponse> issue(
            @PathVariable("event_id")
            @NotBlank(message = "event_id is required")
            @Size(max = 64, message = "event_id must be at most 64 characters")
            String eventId,
            @RequestHeader(HEADER_USER_ID)
            @NotBlank(message = "X-User-Id is required")
            @Size(max = 64, message = "X-User-Id must be at most 64 characters")
            String subjectId,
            @RequestBody(required = false) IssueRegistrationRequest request) {
        IssuedRegistration issued = ledgerService.issue(
                subjectId, eventId, request == null ? null : request.checkInClosesAt());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RegistrationResponse.from(issued.registration(), issued.artifact()));
    }

    @GetMapping("/registrations/{registration_id}")
    public RegistrationResponse get(@PathVariable("registration_id") UUID registrationId) {
        return RegistrationResponse.from(ledgerService.get(registrationId));
    }

    @GetMapping("/registrations/{registration_id}/artifact")
    public ArtifactResponse artifact(
            @PathVariable("registration_id") UUID registrationId,
            @RequestHeader(HEADER_USER_ID)
            @NotBlank(message = "X-User-Id is required")
            @Size(max = 64, message = "X-User-Id must be at most 64 characters")
            String callerId,
            @RequestHeader(value = HEADER_USER_ROLES, required = false) String roles) {
        String artifact = ledgerService.artifact(registrationId, callerId, GatewayRoles.isAdmin(roles));
        return new ArtifactResponse(registrationId, artifact);
    }

    @PostMapping("/registrations/{registration_id}/void")
    public RegistrationResponse voidRegistration(
            @PathVariable("registration_id") UUID registrationId,
            @RequestHeader(HEADER_USER_ID)
            @NotBlank(message = "X-User-Id is required")
            @Size(max = 64, message = "X-User-Id must be at most 64 characters")
            String actorId) {
        return RegistrationResponse.from(ledgerService.voidRegistration(registrationId, actorId));
    }

    @PostMapping("/admin/registrations/{registration_id}/force-void")
    public RegistrationResponse forceVoid(
            @PathVariable("registration_id") UUID registrationId,
            @RequestHeader(HEADER_USER_ID)
            @NotBlank(message = "X-User-Id is required")
            @Size(max = 64, message = "X-User-Id must be at most 64 characters")
            String actorId,
            @Valid @RequestBody ForceVoidRequest request) {
        return RegistrationResponse.from(
                ledgerService.forceVoid(registrationId, actorId, request.reason()));
    }

    @GetMapping("/registrations/{registration_id}/check-ins")
    public CheckInAuditResponse checkIns(@PathVariable("registration_id") UUID registrationId) {
        CheckInAuditTrail trail = auditService.trail(registrationId);
        return new CheckInAuditResponse(
                trail.registrationId(),
                trail.intact(),
                trail.brokenRecordId(),
                trail.records().stream().map(CheckInRecordSummary::from).toList());
    }
}
