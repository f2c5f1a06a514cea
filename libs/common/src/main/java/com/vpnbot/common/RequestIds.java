/*
 * どこで: Common ユーティリティ
 * 何を: リクエスト ID を受け取り、無ければ採番する
 * なぜ: ボット側と本体のログを同じ ID で突き合わせるため
 */
package com.vpnbot.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class RequestIds {

  public static final String HEADER_NAME = "X-Request-Id";

  private static final int MAX_LENGTH = 64;
  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._-]+");

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** ヘッダ値が安全な形式ならそのまま使い、そうでなければ新規採番する。 */
  public static String resolve(String candidate) {
    if (candidate == null) {
      return newRequestId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty()
        || trimmed.length() > MAX_LENGTH
        || !ALLOWED.matcher(trimmed).matches()) {
      return newRequestId();
    }
    return trimmed;
  }
}
