/*
 * どこで: Check-in API
 * 何を: チェックイン済み登録の通常無効化(409)を表す例外を定義する
 * なぜ: 出席済みの取り消しは管理者の強制無効化経路に限定するため
 */
package com.campusevents.checkin.api;

public class AlreadyCheckedInException extends RuntimeException {

  public AlreadyCheckedInException(String message) {
    super(message);
  }
}
