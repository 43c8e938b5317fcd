package net.pilotproxy.client.core.file;

import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.Collection;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.log.ArgSupplier;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

class FileUtil {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(FileUtil.class);

  private static final Collection<PosixFilePermission> WRITE_BY_OTHERS =
      Arrays.asList(PosixFilePermission.GROUP_WRITE, PosixFilePermission.OTHERS_WRITE);
  private static final Collection<PosixFilePermission> READ_BY_OTHERS =
      Arrays.asList(PosixFilePermission.GROUP_READ, PosixFilePermission.OTHERS_READ);

  private FileUtil() {}

  /**
   * The file must be a regular file owned by the real user and neither readable nor writable by
   * group or others.
   */
  static void throwWhenNotOwnerOnly(Path filePath, FileSnapshot snapshot, int realUid)
      throws PilotProxyException {
    if (!snapshot.isRegularFile()) {
      throw new PilotProxyException(ErrorCode.PERMISSION_ERROR, filePath, "not a regular file");
    }
    if (snapshot.getOwnerUid() != realUid) {
      logger.debug(
          "The file owner: {} is different than real user: {}", snapshot.getOwnerUid(), realUid);
      throw new PilotProxyException(
          ErrorCode.PERMISSION_ERROR, filePath, "the file owner is different than the real user");
    }

    boolean isWritableByOthers = isPermPresent(snapshot.getPermissions(), WRITE_BY_OTHERS);
    boolean isReadableByOthers = isPermPresent(snapshot.getPermissions(), READ_BY_OTHERS);
    if (isWritableByOthers || isReadableByOthers) {
      logger.debug(
          "File {} access rights: {}",
          filePath,
          (ArgSupplier) () -> PosixFilePermissions.toString(snapshot.getPermissions()));
      throw new PilotProxyException(
          ErrorCode.PERMISSION_ERROR,
          filePath,
          String.format(
              "access is wider than allowed:%s%s",
              isReadableByOthers ? " read" : "", isWritableByOthers ? " write" : ""));
    }
  }

  private static boolean isPermPresent(
      Collection<PosixFilePermission> filePerms, Collection<PosixFilePermission> permsToCheck) {
    return filePerms.stream().anyMatch(permsToCheck::contains);
  }
}
