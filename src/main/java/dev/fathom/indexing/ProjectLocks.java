package dev.fathom.indexing;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serialises index builds per project and artifact.
 *
 * <p>Contention is rejected with {@link IndexingInProgressException} instead of queueing: a second
 * caller would only redo the work the running build is already doing.
 *
 * <p>Entries exist only while their lock is held. Acquisition and release both run inside {@link
 * ConcurrentHashMap#compute}, so an entry is never removed while another caller is taking it.
 */
@Component
public class ProjectLocks {

  private final Map<LockKey, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Runs {@code action} while holding the lock of {@code projectName}'s {@code artifact}.
   *
   * @throws IndexingInProgressException if another thread holds the lock
   */
  public <T> T runExclusive(String projectName, IndexArtifact artifact, Supplier<T> action) {
    LockKey key = new LockKey(projectName, artifact);
    boolean[] acquired = new boolean[1];
    locks.compute(
        key,
        (k, existing) -> {
          ReentrantLock lock = existing != null ? existing : new ReentrantLock();
          acquired[0] = lock.tryLock();
          return lock;
        });
    if (!acquired[0]) {
      throw new IndexingInProgressException(projectName, artifact);
    }
    try {
      return action.get();
    } finally {
      locks.computeIfPresent(
          key,
          (k, lock) -> {
            lock.unlock();
            return lock.isLocked() ? lock : null;
          });
    }
  }

  /** Number of project/artifact pairs currently being built. */
  int size() {
    return locks.size();
  }

  /** True while some thread builds {@code artifact} for {@code projectName}. */
  public boolean isLocked(String projectName, IndexArtifact artifact) {
    ReentrantLock lock = locks.get(new LockKey(projectName, artifact));
    return lock != null && lock.isLocked();
  }

  private record LockKey(String projectName, IndexArtifact artifact) {}
}
