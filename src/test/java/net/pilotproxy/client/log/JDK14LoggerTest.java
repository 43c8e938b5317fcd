package net.pilotproxy.client.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import net.pilotproxy.client.category.TestTags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.LOGGING)
public class JDK14LoggerTest {
  private static final String LOGGER_NAME = "net.pilotproxy.client.log.JDK14LoggerTest";

  private final ListHandler handler = new ListHandler();
  private Logger jdkLogger;
  private Level previousLevel;

  @BeforeEach
  public void setUp() {
    previousLevel = JDK14Logger.getLevel();
    jdkLogger = Logger.getLogger(LOGGER_NAME);
    jdkLogger.addHandler(handler);
  }

  @AfterEach
  public void tearDown() {
    jdkLogger.removeHandler(handler);
    JDK14Logger.setLevel(previousLevel);
  }

  @Test
  public void testPlaceholdersAndLazyArguments() {
    JDK14Logger.setLevel(Level.FINE);
    JDK14Logger logger = new JDK14Logger(LOGGER_NAME);

    logger.debug("Read {} bytes from {}", 42, (ArgSupplier) () -> "/tmp/x509up_u1000");

    assertEquals(1, handler.records.size());
    LogRecord record = handler.records.get(0);
    assertEquals("Read 42 bytes from /tmp/x509up_u1000", record.getMessage());
    assertEquals(Level.FINE, record.getLevel());
    assertEquals(JDK14LoggerTest.class.getName(), record.getSourceClassName());
    assertEquals("testPlaceholdersAndLazyArguments", record.getSourceMethodName());
  }

  @Test
  public void testThrowableIsAttached() {
    JDK14Logger.setLevel(Level.INFO);
    JDK14Logger logger = new JDK14Logger(LOGGER_NAME);
    IllegalStateException ex = new IllegalStateException("boom");

    logger.error("failed", ex);

    assertEquals(1, handler.records.size());
    assertSame(ex, handler.records.get(0).getThrown());
    assertEquals(Level.SEVERE, handler.records.get(0).getLevel());
  }

  @Test
  public void testLevelFollowsPrefixLogger() {
    JDK14Logger.setLevel(Level.WARNING);
    JDK14Logger logger = new JDK14Logger(LOGGER_NAME);

    assertTrue(logger.isWarnEnabled());
    assertTrue(logger.isErrorEnabled());
    assertFalse(logger.isInfoEnabled());
    assertFalse(logger.isDebugEnabled());

    logger.info("not published");
    assertTrue(handler.records.isEmpty());
  }
}
