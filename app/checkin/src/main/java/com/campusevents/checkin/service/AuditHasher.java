/*
 * どこで: Check-in サービス補助
 * 何を: 監査レコードの連鎖ハッシュとスキャン文字列のダイジェストを生成する
 * なぜ: 追記後の改ざんを再計算で検出できるようにするため
 */
package com.campusevents.checkin.service;

import com.campusevents.checkin.model.CheckInOutcome;
import com.campusevents.checkin.model.CheckInReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditHasher {

    private final ObjectMapper objectMapper;

    public String hashRecord(
            String prevHash,
            UUID recordId,
            UUID registrationId,
            CheckInOutcome outcome,
            CheckInReason reason,
            String deviceId,
            String artifactDigest,
            Instant occurredAt) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        // 順序を固定し、同一入力で同じ JSON が出るようにする
        canonical.put("prev_hash", prevHash);
        canonical.put("record_id", recordId.toString());
        canonical.put("registration_id", registrationId == null ? null : registrationId.toString());
        canonical.put("outcome", outcome.name());
        canonical.put("reason", reason == null ? null : reason.name());
        canonical.put("device_id", deviceId);
        canonical.put("artifact_digest", artifactDigest);
        canonical.put("occurred_at", occurredAt.toString());
        try {
            return sha256Hex(objectMapper.writeValueAsString(canonical));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize audit record for hashing", ex);
        }
    }

    public String digestArtifact(String artifact) {
        return sha256Hex(artifact == null ? "" : artifact);
    }

    private String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private String toHex(byte[] bytes) {
        StringBuilder builder = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            builder.append(String.format("%02x", value));
        }
        return builder.toString();
    }
}
