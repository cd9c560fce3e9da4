package com.example.auth.service;

import com.example.auth.model.LoginAttempt;
import java.time.Instant;
import java.util.Optional;

/**
 * 進行中のログイン試行(state)を保持するストア。
 *
 * <p>単一プロセスではメモリ実装を使う。複数インスタンス構成では共有ストア実装へ差し替える。
 */
public interface LoginStateStore {

  void save(LoginAttempt attempt);

  /**
   * 未消費の state を原子的に消費済みへ遷移させ、ストアから取り除く。
   *
   * <p>同じ state に対する並行呼び出しのうち、値を受け取れるのは 1 件のみ。
   *
   * @return 消費に成功した試行(consumed=true)。存在しない・消費済みの場合は empty
   */
  Optional<LoginAttempt> claim(String stateToken);

  /** createdAt が cutoff より前の記録を削除し、削除件数を返す。 */
  int purgeCreatedBefore(Instant cutoff);

  int size();
}
