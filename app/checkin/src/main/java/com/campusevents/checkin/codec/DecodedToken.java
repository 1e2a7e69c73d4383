/*
 * どこで: Check-in トークンコーデック
 * 何を: 復号済みの登録 ID と検証値を表す
 * なぜ: 埋め込まれた ID を信用せず、台帳の secret で再検証させるため
 */
package com.campusevents.checkin.codec;

import java.util.UUID;

public record DecodedToken(UUID registrationId, String verificationValue) {}
