/*
 * どこで: Check-in アプリの設定バインド
 * 何を: チェックイン用トークンの接頭辞と鍵長を保持する
 * なぜ: 印刷済みコードとの互換を保ったまま形式の版を切り替えられるようにするため
 */
package com.campusevents.checkin.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "checkin.token")
public record CheckInTokenProperties(String prefix, int verificationBytes, int secretBytes) {

  public CheckInTokenProperties {
    prefix = prefix == null || prefix.isBlank() ? "CK1" : prefix;
    verificationBytes = verificationBytes <= 0 ? 16 : verificationBytes;
    secretBytes = secretBytes <= 0 ? 32 : secretBytes;
    if (prefix.contains(".")) {
      throw new IllegalArgumentException("checkin.token.prefix must not contain '.'");
    }
    if (verificationBytes > 32) {
      throw new IllegalArgumentException("checkin.token.verification-bytes must be <= 32");
    }
  }
}
