package hdlopt.ui;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class OptimizerLoggingTest {

  @AfterEach
  void tearDown() {
    OptimizerLogging.configure(Level.WARN);
  }

  @Test
  void testConfigureSetsRootLevel() {
    OptimizerLogging.configure(Level.ERROR);
    Assertions.assertEquals(Level.ERROR, LogManager.getRootLogger().getLevel());
    OptimizerLogging.configure(Level.DEBUG);
    Assertions.assertEquals(Level.DEBUG, LogManager.getRootLogger().getLevel());
  }
}
