/*
 * どこで: Check-in ドメインモデル
 * 何を: ACCEPTED/DUPLICATE 以外の結果に付ける理由を定義する
 * なぜ: 紛争時に「なぜ拒否されたか」を監査ログから再構成できるようにするため
 */
package com.campusevents.checkin.model;

public enum CheckInReason {
    MALFORMED_ARTIFACT("artifact is malformed"),
    UNKNOWN_REGISTRATION("registration not found"),
    VERIFICATION_MISMATCH("verification value mismatch"),
    REGISTRATION_VOIDED("registration voided"),
    CHECK_IN_CLOSED("check-in window closed");

    private final String message;

    CheckInReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
