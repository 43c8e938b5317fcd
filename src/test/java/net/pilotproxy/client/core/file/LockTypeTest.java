package net.pilotproxy.client.core.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import net.pilotproxy.client.category.TestTags;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@Tag(TestTags.FILE)
class LockTypeTest {

  @ParameterizedTest
  @CsvSource({
    "none,NONE",
    "nolock,NONE",
    "range,RANGE",
    "FCNTL,RANGE",
    "flag,FLAG",
    "' Flock ',FLAG"
  })
  void shouldParseNamesAndAliases(String value, LockType expected) throws Exception {
    assertEquals(expected, LockType.fromString(value));
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"lockf", "range,flag"})
  void shouldRejectUnknownNames(String value) {
    PilotProxyException ex =
        assertThrows(PilotProxyException.class, () -> LockType.fromString(value));
    assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());
  }

  @Test
  void shouldCreateMatchingLocker() {
    assertTrue(LockType.NONE.newLocker() instanceof NoFileLocker);
    assertTrue(LockType.RANGE.newLocker() instanceof RangeFileLocker);
    assertTrue(LockType.FLAG.newLocker() instanceof FlagFileLocker);
  }
}
