package com.gentoro.lexgraph;

import com.gentoro.lexgraph.exception.ExceptionUtil;
import com.gentoro.lexgraph.exception.LexGraphException;
import com.gentoro.lexgraph.exception.ValidationException;

/** Command line entry point; maps failures to exit statuses. */
public class LexGraphApp {

  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(LexGraphApp.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_INPUT_ERROR = 1;
  public static final int EXIT_INGESTION_ERROR = 2;
  public static final int EXIT_USAGE = 64;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /** Runs the command line and returns its exit status instead of terminating the JVM. */
  public static int run(String[] args) {
    StartupParameters parameters;
    try {
      parameters = new StartupParameters(args);
    } catch (ValidationException e) {
      System.err.println("Error: " + e.getMessage());
      System.err.println(StartupParameters.usage());
      return EXIT_USAGE;
    }
    if (parameters.isHelp()) {
      System.out.println(StartupParameters.usage());
      return EXIT_OK;
    }

    try {
      LexGraph app = new LexGraph(parameters, System.out);
      app.initialize();
      app.run();
      return EXIT_OK;
    } catch (ValidationException e) {
      System.err.println("Error: " + e.getMessage());
      return EXIT_USAGE;
    } catch (LexGraphException e) {
      int status = e.getCode().exitStatus();
      String label = status == EXIT_INGESTION_ERROR ? "Ingestion error" : "Error";
      log.error("{}: {}", label, e.getMessage());
      log.debug("Failure detail\n{}", ExceptionUtil.formatCompactStackTrace(e));
      System.err.println(label + ": " + ExceptionUtil.describe(e));
      Throwable root = ExceptionUtil.rootCause(e);
      if (root != e) {
        System.err.println("Caused by: " + ExceptionUtil.describe(root));
      }
      return status;
    }
  }
}
