/*
 * どこで: Check-in ドメインモデル
 * 何を: registrations テーブルのスナップショットを表す
 * なぜ: 台帳・照合・レポートで同じ行表現を共有するため
 */
package com.campusevents.checkin.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

public record RegistrationRecord(
        UUID registrationId,
        long issueSeq,
        String subjectId,
        String eventId,
        byte[] tokenSecret,
        RegistrationState state,
        Instant createdAt,
        Instant checkedInAt,
        Instant voidedAt,
        Instant checkInClosesAt) {

    public RegistrationRecord {
        // SpotBugs の EI_EXPOSE_REP2 対応: secret は防御的コピーで保持する
        tokenSecret = tokenSecret == null ? null : tokenSecret.clone();
    }

    @Override
    public byte[] tokenSecret() {
        return tokenSecret == null ? null : tokenSecret.clone();
    }

    public boolean isCheckInClosed(Instant now) {
        return checkInClosesAt != null && now.isAfter(checkInClosesAt);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RegistrationRecord that)) {
            return false;
        }
        return issueSeq == that.issueSeq
                && Objects.equals(registrationId, that.registrationId)
                && Objects.equals(subjectId, that.subjectId)
                && Objects.equals(eventId, that.eventId)
                && Arrays.equals(tokenSecret, that.tokenSecret)
                && state == that.state
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(checkedInAt, that.checkedInAt)
                && Objects.equals(voidedAt, that.voidedAt)
                && Objects.equals(checkInClosesAt, that.checkInClosesAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(registrationId, issueSeq, subjectId, eventId, state,
                createdAt, checkedInAt, voidedAt, checkInClosesAt);
        return 31 * result + Arrays.hashCode(tokenSecret);
    }

    @Override
    public String toString() {
        // secret はログに出さない
        return "RegistrationRecord[registrationId=" + registrationId
                + ", subjectId=" + subjectId
                + ", eventId=" + eventId
                + ", state=" + state + "]";
    }
}
