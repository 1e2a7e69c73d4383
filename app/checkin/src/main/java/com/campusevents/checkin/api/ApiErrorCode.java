/*
 * どこで: Check-in API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.campusevents.checkin.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    NOT_FOUND,
    FORBIDDEN,
    DUPLICATE_REGISTRATION,
    ALREADY_CHECKED_IN,
    STORAGE_UNAVAILABLE
}
