/*
 * どこで: Check-in API
 * 何を: 同一 (subject, event) の二重発行(409)を表す例外を定義する
 * なぜ: 一意制約違反を再試行対象ではない業務エラーとして返すため
 */
package com.campusevents.checkin.api;

public class DuplicateRegistrationException extends RuntimeException {

  public DuplicateRegistrationException(String message) {
    super(message);
  }
}
