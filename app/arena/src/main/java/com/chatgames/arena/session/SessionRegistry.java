/*
 * どこで: Arena セッション管理
 * 何を: チャンネルごとに最大 1 件の進行中セッションと、再戦待ちの終了セッションを保持する
 * なぜ: 同一チャンネルでの同時承認に対して、原子的な check-and-insert で 1 件だけを成立させるため
 */
package com.chatgames.arena.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.springframework.stereotype.Component;

@Component
public class SessionRegistry {

  private final ConcurrentMap<String, GameSession> active = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, FinishedSession> finished = new ConcurrentHashMap<>();

  /** 既にセッションがあるチャンネルでは false(ALREADY_ACTIVE)。 */
  public boolean tryCreate(String channelId, GameSession session) {
    if (active.putIfAbsent(channelId, session) != null) {
      return false;
    }
    finished.remove(channelId);
    return true;
  }

  public Optional<GameSession> get(String channelId) {
    return Optional.ofNullable(active.get(channelId));
  }

  /** 存在しなくてもエラーにしない。 */
  public void remove(String channelId) {
    active.remove(channelId);
  }

  /** 指定セッションが登録中の場合だけ外す。後から入った別セッションは消さない。 */
  public boolean remove(String channelId, GameSession session) {
    return active.remove(channelId, session);
  }

  public List<GameSession> activeSessions() {
    return List.copyOf(active.values());
  }

  public int activeCount() {
    return active.size();
  }

  public void rememberFinished(GameSession session, Instant finishedAt) {
    finished.put(session.channelId(), new FinishedSession(session, finishedAt));
  }

  public Optional<FinishedSession> finished(String channelId) {
    return Optional.ofNullable(finished.get(channelId));
  }

  /** 再戦の受付を取り合うときに使う。先に取った呼び出しだけが true。 */
  public boolean claimFinished(String channelId, FinishedSession entry) {
    return finished.remove(channelId, entry);
  }

  /**
   * 役割: 再戦枠を取り、同じチャンネルに次のセッションを登録する。
   * 動作: チャンネルの登録と再戦枠の取得を 1 つの原子的操作で行う。
   * - 進行中セッションがあれば再戦枠には触れずに空を返す。
   * - 再戦枠を先に取られていれば空を返す。
   * - factory は両方を確保できたときだけ呼ばれる。
   */
  public Optional<GameSession> tryRematch(
      String channelId, FinishedSession entry, Function<FinishedSession, GameSession> factory) {
    final AtomicReference<GameSession> created = new AtomicReference<>();
    active.computeIfAbsent(
        channelId,
        key -> {
          if (!finished.remove(channelId, entry)) {
            return null;
          }
          created.set(factory.apply(entry));
          return created.get();
        });
    return Optional.ofNullable(created.get());
  }

  public int evictFinishedBefore(Instant cutoff) {
    int evicted = 0;
    for (FinishedSession entry : List.copyOf(finished.values())) {
      if (entry.finishedAt().isBefore(cutoff)
          && finished.remove(entry.session().channelId(), entry)) {
        evicted++;
      }
    }
    return evicted;
  }
}
