/*
 * どこで: Check-in ドメインモデル
 * 何を: 登録の状態を定義する
 * なぜ: 状態遷移と DB の CHECK 制約を一致させるため
 */
package com.campusevents.checkin.model;

// ISSUED -> CHECKED_IN / ISSUED -> VOID。CHECKED_IN -> VOID は管理者の強制無効化のみ。
public enum RegistrationState {
    ISSUED,
    CHECKED_IN,
    VOID
}
