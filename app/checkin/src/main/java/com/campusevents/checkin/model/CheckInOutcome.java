/*
 * どこで: Check-in ドメインモデル
 * 何を: スキャン 1 回あたりの結果を定義する
 * なぜ: 監査ログと API 応答で同じ語彙を使うため
 */
package com.campusevents.checkin.model;

public enum CheckInOutcome {
    ACCEPTED,
    DUPLICATE,
    INVALID,
    EXPIRED
}
