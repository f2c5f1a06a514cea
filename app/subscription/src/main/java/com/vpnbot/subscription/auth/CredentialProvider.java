package com.vpnbot.subscription.auth;

/** HTTP 層がリクエスト署名に使う資格情報の取得口。 */
public interface CredentialProvider {

  /** 有効な資格情報を返す。期限切れなら再認証してから返す。 */
  Credential getCredential();

  /**
   * 401 で拒否された資格情報を置き換える。
   *
   * <p>別の呼び出しが既に置き換えていれば、再認証せずにその新しい資格情報を返す。
   */
  Credential refreshAfterRejection(Credential rejected);
}
