/*
 * どこで: Auth トークン保守
 * 何を: 期限切れになったトークンの失効エントリを定期的に削除する
 * なぜ: 失効リストの大きさをトークン TTL の範囲に収めるため
 */
package com.example.auth.service;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RevocationPurgeWorker {

  private static final Logger logger = LoggerFactory.getLogger(RevocationPurgeWorker.class);

  private final RevocationStore revocationStore;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${auth.token.revocation-purge-interval:PT5M}")
  public void run() {
    final int purged = revocationStore.purgeExpired(Instant.now(clock));
    if (purged > 0) {
      logger.info("revocation store purged expired entries count={}", purged);
    }
  }
}
