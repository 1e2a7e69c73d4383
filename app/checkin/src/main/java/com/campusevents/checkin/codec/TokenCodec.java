/*
 * どこで: Check-in トークンコーデック
 * 何を: 登録 ID と鍵付きダイジェストをスキャン可能な文字列に符号化/復号する
 * なぜ: 改ざんされた ID を照合段階で確実に弾くため
 */
package com.campusevents.checkin.codec;

import com.campusevents.checkin.config.CheckInTokenProperties;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

@Component
public class TokenCodec {

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final String SEPARATOR = ".";
  private static final int ID_HEX_LENGTH = 32;
  // 小文字 16 進のみ許可する。大文字を許すと 1 文字の改変が同じ値に復号されてしまう。
  private static final Pattern ID_PATTERN = Pattern.compile("[0-9a-f]{" + ID_HEX_LENGTH + "}");
  private static final HexFormat HEX = HexFormat.of();

  private final CheckInTokenProperties properties;
  private final Pattern verificationPattern;
  private final SecureRandom secureRandom = new SecureRandom();

  public TokenCodec(CheckInTokenProperties properties) {
    this.properties = properties;
    this.verificationPattern =
        Pattern.compile("[0-9a-f]{" + (properties.verificationBytes() * 2) + "}");
  }

  public byte[] newSecret() {
    final byte[] secret = new byte[properties.secretBytes()];
    secureRandom.nextBytes(secret);
    return secret;
  }

  public String encode(UUID registrationId, byte[] secret) {
    final String idHex = toHex(registrationId);
    return signedPart(idHex) + SEPARATOR + verificationValue(idHex, secret);
  }

  public DecodedToken decode(String artifact) {
    if (artifact == null) {
      throw new InvalidTokenFormatException("artifact is required");
    }
    // スキャナは末尾に改行を付けることがあるため前後の空白だけは許容する。
    final String[] parts = artifact.strip().split(Pattern.quote(SEPARATOR), -1);
    if (parts.length != 3) {
      throw new InvalidTokenFormatException("artifact must have 3 segments");
    }
    if (!properties.prefix().equals(parts[0])) {
      throw new InvalidTokenFormatException("unsupported artifact prefix");
    }
    if (!ID_PATTERN.matcher(parts[1]).matches()) {
      throw new InvalidTokenFormatException("registration id segment is malformed");
    }
    if (!verificationPattern.matcher(parts[2]).matches()) {
      throw new InvalidTokenFormatException("verification segment is malformed");
    }
    return new DecodedToken(fromHex(parts[1]), parts[2]);
  }

  public boolean verify(DecodedToken token, byte[] secret) {
    final String expected = verificationValue(toHex(token.registrationId()), secret);
    // 比較は定数時間で行う。
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        token.verificationValue().getBytes(StandardCharsets.US_ASCII));
  }

  private String signedPart(String idHex) {
    return properties.prefix() + SEPARATOR + idHex;
  }

  private String verificationValue(String idHex, byte[] secret) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("token secret is required");
    }
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
      final byte[] digest = mac.doFinal(signedPart(idHex).getBytes(StandardCharsets.US_ASCII));
      return HEX.formatHex(digest, 0, properties.verificationBytes());
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("HmacSHA256 algorithm not available", ex);
    } catch (InvalidKeyException ex) {
      throw new IllegalStateException("token secret rejected by HmacSHA256", ex);
    }
  }

  private static String toHex(UUID id) {
    final ByteBuffer buffer = ByteBuffer.allocate(16);
    buffer.putLong(id.getMostSignificantBits());
    buffer.putLong(id.getLeastSignificantBits());
    return HEX.formatHex(buffer.array());
  }

  private static UUID fromHex(String idHex) {
    final long most = HexFormat.fromHexDigitsToLong(idHex, 0, 16);
    final long least = HexFormat.fromHexDigitsToLong(idHex, 16, 32);
    return new UUID(most, least);
  }
}
