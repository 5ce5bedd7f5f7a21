package eure.schema;

import org.junit.jupiter.api.BeforeAll;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Base class for schema tests that configures JUL logging from system properties.
/// All test classes should extend this class to enable consistent logging behavior.
public class SchemaLoggingConfig {
  @BeforeAll
  static void enableJulDebug() {
    Logger root = Logger.getLogger("");
    String levelProp = System.getProperty("java.util.logging.ConsoleHandler.level");
    Level targetLevel = Level.INFO;
    if (levelProp != null) {
      try {
        targetLevel = Level.parse(levelProp.trim());
      } catch (IllegalArgumentException ex) {
        try {
          targetLevel = Level.parse(levelProp.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
          System.err.println("Unrecognized logging level from 'java.util.logging.ConsoleHandler.level': " + levelProp);
        }
      }
    }
    // Ensure the root logger honors the most verbose configured level
    if (root.getLevel() == null || root.getLevel().intValue() > targetLevel.intValue()) {
      root.setLevel(targetLevel);
    }
    for (Handler handler : root.getHandlers()) {
      Level handlerLevel = handler.getLevel();
      if (handlerLevel == null || handlerLevel.intValue() > targetLevel.intValue()) {
        handler.setLevel(targetLevel);
      }
    }
  }
}
