package net.pilotproxy.client.core.file;

import java.io.IOException;

/** Real and effective user/group identity of the running process. */
public interface PosixIdentity {
  int getRealUid();

  int getEffectiveUid();

  int getRealGid();

  int getEffectiveGid();

  void setEffectiveUid(int euid) throws IOException;

  void setEffectiveGid(int egid) throws IOException;
}
