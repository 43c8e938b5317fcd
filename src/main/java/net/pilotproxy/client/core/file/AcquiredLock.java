package net.pilotproxy.client.core.file;

/** A held file lock. Closing it releases the lock; release failures are only logged. */
public interface AcquiredLock extends AutoCloseable {
  @Override
  void close();
}
