/*
 * どこで: Check-in API
 * 何を: 台帳へ到達できない状態(503)を表す例外を定義する
 * なぜ: 永続化できないスキャンを受理扱いにせず、拒否として返すため
 */
package com.campusevents.checkin.api;

public class StorageUnavailableException extends RuntimeException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
