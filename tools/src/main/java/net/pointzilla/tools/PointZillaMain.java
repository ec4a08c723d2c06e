// This file is part of PointZilla.
// Copyright (C) 2026  The PointZilla Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pointzilla.tools;

import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import net.pointzilla.append.AppendResult;
import net.pointzilla.core.AppendContext;
import net.pointzilla.core.PointsAppender;
import net.pointzilla.exceptions.AppendException;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.IllegalDataException;
import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.storage.TimeSeriesStoreFactory;

/**
 * Command line entry point. Exits with 0 on success, 1 when the data, the
 * store or the completion wait failed and 2 on usage or configuration
 * errors.
 */
public class PointZillaMain {
  private static final Logger LOG = LoggerFactory.getLogger(PointZillaMain.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_USAGE = 2;

  private static final long SHUTDOWN_TIMEOUT_MS = 10000;

  private final PrintStream out;

  /**
   * Default ctor.
   * @param out Where help and usage errors are printed.
   */
  public PointZillaMain(final PrintStream out) {
    this.out = out;
  }

  public static void main(final String[] args) {
    System.exit(new PointZillaMain(System.err).execute(args));
  }

  /**
   * Runs the tool.
   * @param args The command line.
   * @return The exit status.
   */
  public int execute(final String[] args) {
    final CliOptions options = new CliOptions();
    final AppendContext context;
    final Config config;
    try {
      options.parse(args);
      if (options.shouldPrintHelp()) {
        options.printHelp(out);
        return EXIT_OK;
      }
      options.honorVerboseFlag();
      config = options.loadConfig();
      context = new ContextLoader(config).load();
    } catch (ConfigurationException e) {
      out.println("pointzilla: " + e.getMessage());
      out.println("Try 'pointzilla --help' for more information");
      return EXIT_USAGE;
    }

    final TimeSeriesStoreFactory factory;
    try {
      factory = storeFactory(config);
    } catch (ConfigurationException e) {
      LOG.error(e.getMessage());
      return EXIT_USAGE;
    }
    try {
      final AppendResult result = new PointsAppender(factory).run(context);
      switch (result.status()) {
      case TIMED_OUT:
        LOG.error("Timed out waiting for the appends to complete after "
            + context.batchPolicy().waitTimeout() + ": " + result);
        return EXIT_FAILED;
      case NOT_SENT:
        LOG.info("No points were appended");
        return EXIT_OK;
      default:
        LOG.info("Appended to " + context.targetSeries() + ": " + result);
        return EXIT_OK;
      }
    } catch (ConfigurationException e) {
      LOG.error(e.getMessage());
      return EXIT_USAGE;
    } catch (AppendException e) {
      LOG.error(e.getMessage() + " (" + e.pointsAccepted()
          + " points were accepted)");
      return EXIT_FAILED;
    } catch (RemoteStoreException e) {
      LOG.error("Store call failed: " + e.getMessage()
          + (e.statusCode() > 0 ? " (status " + e.statusCode() + ")" : ""));
      return EXIT_FAILED;
    } catch (IllegalDataException e) {
      LOG.error(e.getMessage());
      return EXIT_FAILED;
    } catch (RuntimeException e) {
      LOG.error("Unhandled exception", e);
      return EXIT_FAILED;
    } finally {
      try {
        factory.shutdown().join(SHUTDOWN_TIMEOUT_MS);
      } catch (Exception e) {
        LOG.warn("Failed to shut down the store client", e);
      }
    }
  }

  /**
   * @param config The resolved configuration.
   * @return The factory that opens store clients.
   */
  protected TimeSeriesStoreFactory storeFactory(final Config config) {
    return new ContextLoader(config).storeFactory();
  }
}
