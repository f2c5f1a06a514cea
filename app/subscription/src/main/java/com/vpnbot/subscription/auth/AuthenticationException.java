package com.vpnbot.subscription.auth;

public class AuthenticationException extends RuntimeException {

  private final boolean transientFailure;

  public AuthenticationException(boolean transientFailure, String message) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public AuthenticationException(boolean transientFailure, String message, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  /** 通信失敗や 5xx による失敗なら true。資格情報の拒否なら false。 */
  public boolean isTransientFailure() {
    return transientFailure;
  }
}
