package net.pilotproxy.client.core.file;

import java.io.IOException;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/**
 * Temporarily adopts the real user and group identity of a process running with effective root,
 * and puts the effective identity back when closed.
 *
 * <p>Nothing is changed when the effective uid is not root or when the real uid is root. Closing a
 * guard that did not change anything is a no-op, and so is closing it twice.
 */
public final class PrivilegeGuard implements AutoCloseable {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(PrivilegeGuard.class);

  private static final int ROOT = 0;

  private final PosixIdentity identity;
  private final int savedEuid;
  private final int savedEgid;
  private boolean lowered;

  private PrivilegeGuard(PosixIdentity identity, int savedEuid, int savedEgid) {
    this.identity = identity;
    this.savedEuid = savedEuid;
    this.savedEgid = savedEgid;
  }

  /**
   * Drops the effective identity to the real one when running as effective root on behalf of a
   * non-root user.
   *
   * @param identity process identity
   * @return guard to close once the unprivileged work is done
   * @throws PilotProxyException PRIVILEGE_ERROR if the group or user identity cannot be lowered.
   *     The group is restored before throwing when only the user change failed.
   */
  public static PrivilegeGuard dropToRealIdentity(PosixIdentity identity)
      throws PilotProxyException {
    int uid = identity.getRealUid();
    int gid = identity.getRealGid();
    int euid = identity.getEffectiveUid();
    int egid = identity.getEffectiveGid();

    PrivilegeGuard guard = new PrivilegeGuard(identity, euid, egid);
    if (euid != ROOT || uid == ROOT) {
      logger.trace("No privilege drop needed: uid={}, euid={}", uid, euid);
      return guard;
    }

    // the real gid may legitimately be 0
    if (gid != egid) {
      try {
        identity.setEffectiveGid(gid);
      } catch (IOException ex) {
        throw new PilotProxyException(ex, ErrorCode.PRIVILEGE_ERROR, ex.getMessage());
      }
    }

    try {
      identity.setEffectiveUid(uid);
    } catch (IOException ex) {
      if (gid != egid) {
        try {
          identity.setEffectiveGid(egid);
        } catch (IOException restoreEx) {
          ex.addSuppressed(restoreEx);
          logger.error("Cannot restore effective gid {} after failed privilege drop", egid);
        }
      }
      throw new PilotProxyException(ex, ErrorCode.PRIVILEGE_ERROR, ex.getMessage());
    }

    guard.lowered = true;
    logger.debug("Dropped privilege to uid={}, gid={}", uid, gid);
    return guard;
  }

  public boolean isLowered() {
    return lowered;
  }

  /**
   * Restores the effective uid first and then the effective gid, since the gid can only be raised
   * again with root privilege.
   *
   * @throws PilotProxyException PRIVILEGE_ERROR if the original identity cannot be restored
   */
  @Override
  public void close() throws PilotProxyException {
    if (!lowered) {
      return;
    }
    lowered = false;
    try {
      identity.setEffectiveUid(savedEuid);
      identity.setEffectiveGid(savedEgid);
    } catch (IOException ex) {
      logger.error("Cannot restore effective identity {}:{}", savedEuid, savedEgid);
      throw new PilotProxyException(ex, ErrorCode.PRIVILEGE_ERROR, ex.getMessage());
    }
    logger.debug("Restored privilege to euid={}, egid={}", savedEuid, savedEgid);
  }
}
