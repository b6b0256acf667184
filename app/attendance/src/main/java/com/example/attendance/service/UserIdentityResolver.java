package com.example.attendance.service;

import com.example.attendance.model.UserIdentity;
import java.util.Optional;

/** チャットの投稿者 ID を内部ユーザーへ解決する。未登録の投稿者は空を返す。 */
public interface UserIdentityResolver {

  Optional<UserIdentity> resolve(String tenantId, String authorExternalId);
}
