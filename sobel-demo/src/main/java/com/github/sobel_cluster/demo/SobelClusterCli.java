// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.demo;

import com.github.sobel_cluster.ClusterConfig;
import com.github.sobel_cluster.ClusterException;
import com.github.sobel_cluster.Coordinator;
import com.github.sobel_cluster.RasterImage;
import com.github.sobel_cluster.SectionWorker;
import com.github.sobel_cluster.net.TcpListener;
import com.github.sobel_cluster.net.TcpTransport;
import com.github.sobel_cluster.transport.InMemoryCluster;
import com.github.sobel_cluster.transport.Transport;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;

import static com.github.sobel_cluster.demo.DemoLogger.LOGGER;

/// Runs edge detection on an image file.
///
/// ```
/// SobelClusterCli <image> [--workers N] [--output result.png] [--kernel kernel.properties]
/// SobelClusterCli <image> --listen PORT --workers N [--output result.png] [--kernel kernel.properties]
/// SobelClusterCli --join HOST:PORT
/// ```
///
/// Without `--listen` or `--join` the coordinator and its workers run as threads of this process. With `--listen`
/// the coordinator waits for `N` processes started with `--join`.
public class SobelClusterCli {
  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String HELP = "help";
  private static final String WORKERS = "workers";
  private static final String OUTPUT = "output";
  private static final String KERNEL = "kernel";
  private static final String LISTEN = "listen";
  private static final String JOIN = "join";
  private static final String JOIN_TIMEOUT = "join-timeout";
  private static final String DEFAULT_OUTPUT = "result.png";
  private static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(60);

  public static void main(String[] args) {
    LoggerConfig.initialize();
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    final var parser = new CommandLineParser();
    parser.parse(args);
    if (parser.hasOption(HELP) || parser.hasOption("h")) {
      printHelp(out);
      return EXIT_OK;
    }
    try {
      if (parser.hasOption(JOIN)) {
        return join(parser, out);
      }
      if (parser.remainingArgs().size() != 1) {
        err.println("Expected exactly one input image but got " + parser.remainingArgs());
        printHelp(err);
        return EXIT_USAGE;
      }
      var config = ClusterConfig.fromSystemProperties();
      final var kernel = parser.option(KERNEL);
      if (kernel.isPresent()) {
        config = config.withKernelPath(Path.of(kernel.get()));
      }
      final var output = Path.of(parser.option(OUTPUT).orElse(DEFAULT_OUTPUT));
      final var image = ImageFiles.load(Path.of(parser.remainingArgs().get(0)));
      final RasterImage result = parser.hasOption(LISTEN)
          ? runListening(parser, config, image)
          : runLocal(parser, config, image);
      ImageFiles.save(result, output);
      out.println("Wrote " + result.width() + "x" + result.height() + " edge map to " + output);
      return EXIT_OK;
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      printHelp(err);
      return EXIT_USAGE;
    } catch (ClusterException e) {
      LOGGER.log(Level.FINE, "Run failed", e);
      err.println(e.diagnostic());
      return EXIT_FAILED;
    }
  }

  static RasterImage runLocal(CommandLineParser parser, ClusterConfig config, RasterImage image) {
    final int defaultWorkers = Math.min(Runtime.getRuntime().availableProcessors(), image.height());
    final int workers = parser.nonNegativeInt(WORKERS).orElse(defaultWorkers);
    LOGGER.info(() -> "Running " + workers + " in-process workers");
    final ExecutorService threads = Executors.newFixedThreadPool(Math.max(1, workers), runnable -> {
      final var thread = new Thread(runnable, "section-worker");
      thread.setDaemon(true);
      return thread;
    });
    final List<Future<Integer>> served = new ArrayList<>();
    try (var cluster = new InMemoryCluster(workers + 1)) {
      for (Transport transport : cluster.workers()) {
        served.add(threads.submit(() -> serve(transport, config)));
      }
      return new Coordinator(cluster.coordinator(), config).run(image);
    } finally {
      threads.shutdown();
      awaitWorkers(served);
    }
  }

  static RasterImage runListening(CommandLineParser parser, ClusterConfig config, RasterImage image) {
    final int port = parser.nonNegativeInt(LISTEN).orElseThrow();
    final int workers = parser.nonNegativeInt(WORKERS)
        .orElseThrow(() -> new IllegalArgumentException("--" + LISTEN + " needs --" + WORKERS));
    final var timeout = parser.nonNegativeInt(JOIN_TIMEOUT).map(s -> Duration.ofSeconds(s))
        .orElse(DEFAULT_JOIN_TIMEOUT);
    try (var listener = new TcpListener(port);
         var transport = listener.accept(workers, timeout)) {
      return new Coordinator(transport, config).run(image);
    }
  }

  static int join(CommandLineParser parser, PrintStream out) {
    final var address = parser.option(JOIN).orElseThrow();
    final int colon = address.lastIndexOf(':');
    if (colon < 1 || colon == address.length() - 1) {
      throw new IllegalArgumentException("--" + JOIN + " expects HOST:PORT but got '" + address + "'");
    }
    final var host = address.substring(0, colon);
    final int port;
    try {
      port = Integer.parseInt(address.substring(colon + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port in '" + address + "'", e);
    }
    final var timeout = parser.nonNegativeInt(JOIN_TIMEOUT).map(s -> Duration.ofSeconds(s))
        .orElse(DEFAULT_JOIN_TIMEOUT);
    try (var transport = TcpTransport.connect(host, port, timeout)) {
      final int served = serve(transport, ClusterConfig.fromSystemProperties());
      out.println(transport.self() + " served " + served + " sections");
    }
    return EXIT_OK;
  }

  private static int serve(Transport transport, ClusterConfig config) {
    try (var worker = new SectionWorker(transport, config)) {
      return worker.serve();
    }
  }

  private static void awaitWorkers(List<Future<Integer>> served) {
    for (Future<Integer> future : served) {
      try {
        final int count = future.get();
        LOGGER.finer(() -> "In-process worker served " + count + " sections");
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (ExecutionException e) {
        LOGGER.log(Level.WARNING, "In-process worker failed", e.getCause());
      }
    }
  }

  static void printHelp(PrintStream out) {
    out.println("Usage: java " + SobelClusterCli.class.getName() + " <image> [options]");
    out.println("       java " + SobelClusterCli.class.getName() + " --" + JOIN + " HOST:PORT");
    out.println("  --" + WORKERS + " N             number of workers (default: min(cores, image height))");
    out.println("  --" + OUTPUT + " PATH           output image (default: " + DEFAULT_OUTPUT + ")");
    out.println("  --" + KERNEL + " PATH           properties file with kernel.gx and kernel.gy");
    out.println("  --" + LISTEN + " PORT           wait for --workers processes to join over TCP");
    out.println("  --" + JOIN + " HOST:PORT        serve sections for a listening coordinator");
    out.println("  --" + JOIN_TIMEOUT + " SECONDS  how long to wait for the group to form (default: 60)");
    out.println("  -h, --help                show this help message");
  }
}
