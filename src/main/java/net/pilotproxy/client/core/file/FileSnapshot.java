package net.pilotproxy.client.core.file;

import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** Immutable result of one stat of a file. */
public final class FileSnapshot {
  private final long size;
  private final FileTime lastModifiedTime;
  private final FileTime changeTime;
  private final Object fileKey;
  private final int ownerUid;
  private final Set<PosixFilePermission> permissions;
  private final boolean regularFile;

  public FileSnapshot(
      long size,
      FileTime lastModifiedTime,
      FileTime changeTime,
      Object fileKey,
      int ownerUid,
      Set<PosixFilePermission> permissions,
      boolean regularFile) {
    this.size = size;
    this.lastModifiedTime = lastModifiedTime;
    this.changeTime = changeTime;
    this.fileKey = fileKey;
    this.ownerUid = ownerUid;
    this.permissions =
        permissions.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(permissions));
    this.regularFile = regularFile;
  }

  public long getSize() {
    return size;
  }

  public FileTime getLastModifiedTime() {
    return lastModifiedTime;
  }

  public FileTime getChangeTime() {
    return changeTime;
  }

  public Object getFileKey() {
    return fileKey;
  }

  public int getOwnerUid() {
    return ownerUid;
  }

  public Set<PosixFilePermission> getPermissions() {
    return permissions;
  }

  public boolean isRegularFile() {
    return regularFile;
  }

  /**
   * Size, modification time and inode change time must all match. The change time cannot be set
   * from user space, so a rewrite followed by a touch to the old mtime is still detected.
   *
   * @param previous earlier snapshot of the same path
   * @return true if nothing observable changed in between
   */
  public boolean isUnchangedSince(FileSnapshot previous) {
    return previous != null
        && size == previous.size
        && Objects.equals(lastModifiedTime, previous.lastModifiedTime)
        && Objects.equals(changeTime, previous.changeTime)
        && Objects.equals(fileKey, previous.fileKey);
  }

  @Override
  public String toString() {
    return "FileSnapshot{size="
        + size
        + ", mtime="
        + lastModifiedTime
        + ", ctime="
        + changeTime
        + ", fileKey="
        + fileKey
        + ", ownerUid="
        + ownerUid
        + ", permissions="
        + permissions
        + '}';
  }
}
