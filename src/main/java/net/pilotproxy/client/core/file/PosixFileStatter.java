package net.pilotproxy.client.core.file;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stats through the {@code unix} attribute view. Links are followed, so a descriptor path such as
 * {@code /proc/self/fd/7} yields the attributes of the opened file, like fstat(2).
 */
public class PosixFileStatter implements FileStatter {
  private static final String ATTRIBUTES =
      "unix:size,lastModifiedTime,ctime,dev,ino,uid,permissions,isRegularFile";

  @Override
  @SuppressWarnings("unchecked")
  public FileSnapshot stat(Path path) throws IOException {
    Map<String, Object> attrs;
    try {
      attrs = Files.readAttributes(path, ATTRIBUTES);
    } catch (UnsupportedOperationException | IllegalArgumentException ex) {
      throw new IOException("unix file attributes are not supported for " + path, ex);
    }
    List<Object> fileKey = Arrays.asList(attrs.get("dev"), attrs.get("ino"));
    return new FileSnapshot(
        (Long) attrs.get("size"),
        (FileTime) attrs.get("lastModifiedTime"),
        (FileTime) attrs.get("ctime"),
        fileKey,
        (Integer) attrs.get("uid"),
        (Set<PosixFilePermission>) attrs.get("permissions"),
        (Boolean) attrs.get("isRegularFile"));
  }
}
