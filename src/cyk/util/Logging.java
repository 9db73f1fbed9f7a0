package cyk.util;

import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/** java.util.logging setup of the command line tool */
public final class Logging {

  /** level, logger name, message and stack trace on one line */
  public static final String FORMAT = "[%4$s %3$s] %5$s%6$s%n";

  private Logging() {}

  /**
   * Sends every record of at least <code>level</code> to <code>os</code>,
   * replacing the handlers installed so far.
   */
  public static void configure(OutputStream os, Level level) {
    System.setProperty("java.util.logging.SimpleFormatter.format", FORMAT);
    Logger root = Logger.getLogger("");
    for (Handler old : root.getHandlers())
      root.removeHandler(old);
    Handler handler = new StreamHandler(os, new SimpleFormatter()) {
      @Override
      public synchronized void publish(LogRecord record) {
        super.publish(record);
        flush();
      }
    };
    handler.setLevel(level);
    root.addHandler(handler);
    root.setLevel(level);
  }

}
