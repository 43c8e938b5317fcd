package net.pilotproxy.client.core.file;

/** Whether a whole-file lock is shared between readers or exclusive to one writer. */
public enum LockMode {
  SHARED,
  EXCLUSIVE
}
