/*
 * どこで: Attendance サービス層
 * 何を: チャットの投稿者 ID を user_identities 経由で内部ユーザーへ解決する
 * なぜ: 未解決の投稿者でも取り込みを止めず、空として呼び出し側へ返すため
 */
package com.example.attendance.service;

import com.example.attendance.model.UserIdentity;
import com.example.attendance.repository.UserIdentityRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JdbcUserIdentityResolver implements UserIdentityResolver {

  private final UserIdentityRepository userIdentityRepository;

  @Override
  public Optional<UserIdentity> resolve(String tenantId, String authorExternalId) {
    if (authorExternalId == null || authorExternalId.isBlank()) {
      return Optional.empty();
    }
    return userIdentityRepository.findByExternalId(tenantId, authorExternalId);
  }
}
