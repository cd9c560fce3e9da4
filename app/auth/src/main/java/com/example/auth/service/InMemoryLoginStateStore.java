package com.example.auth.service;

import com.example.auth.model.LoginAttempt;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.NonNull;
import org.springframework.stereotype.Component;

@Component
public class InMemoryLoginStateStore implements LoginStateStore {

  private final ConcurrentMap<String, LoginAttempt> attempts = new ConcurrentHashMap<>();

  @Override
  public void save(@NonNull LoginAttempt attempt) {
    attempts.put(attempt.stateToken(), attempt);
  }

  @Override
  public Optional<LoginAttempt> claim(@NonNull String stateToken) {
    final AtomicReference<LoginAttempt> claimed = new AtomicReference<>();
    // computeIfPresent はキー単位で排他されるため、勝者は 1 件に限られる
    attempts.computeIfPresent(
        stateToken,
        (key, attempt) -> {
          if (!attempt.consumed()) {
            claimed.set(attempt.markConsumed());
          }
          return null;
        });
    return Optional.ofNullable(claimed.get());
  }

  @Override
  public int purgeCreatedBefore(@NonNull Instant cutoff) {
    final AtomicInteger removed = new AtomicInteger();
    attempts
        .values()
        .removeIf(
            attempt -> {
              if (attempt.createdAt().isBefore(cutoff)) {
                removed.incrementAndGet();
                return true;
              }
              return false;
            });
    return removed.get();
  }

  @Override
  public int size() {
    return attempts.size();
  }
}
