package com.chatgames.arena.schedule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** テスト用。登録された遅延処理を時間経過ではなく明示的に発火させる。 */
public class ManualGameScheduler implements GameScheduler {

  private final List<Task> tasks = new ArrayList<>();

  @Override
  public synchronized CancelHandle after(Duration delay, Runnable callback) {
    final Task task = new Task(delay, callback);
    tasks.add(task);
    return task::cancel;
  }

  /** 取り消されていない処理をすべて実行する。実行中に登録された処理は次回に回す。 */
  public int fireAll() {
    final List<Task> due;
    synchronized (this) {
      due = new ArrayList<>(tasks);
      tasks.clear();
    }
    int fired = 0;
    for (Task task : due) {
      if (task.fire()) {
        fired++;
      }
    }
    return fired;
  }

  public synchronized int pendingCount() {
    return (int) tasks.stream().filter(task -> !task.done).count();
  }

  public synchronized List<Duration> pendingDelays() {
    return tasks.stream().filter(task -> !task.done).map(task -> task.delay).toList();
  }

  private static final class Task {
    private final Duration delay;
    private final Runnable callback;
    private boolean done;

    private Task(Duration delay, Runnable callback) {
      this.delay = delay;
      this.callback = callback;
    }

    private synchronized boolean cancel() {
      if (done) {
        return false;
      }
      done = true;
      return true;
    }

    private boolean fire() {
      synchronized (this) {
        if (done) {
          return false;
        }
        done = true;
      }
      callback.run();
      return true;
    }
  }
}
