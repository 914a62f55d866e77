package dev.fathom.process;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external commands with a timeout.
 *
 * <p>Standard output and standard error are drained on separate threads while the caller waits, so
 * a chatty process cannot block on a full pipe. A process that outlives its timeout is killed
 * forcibly and reported as {@link ProcessOutcome.TimedOut}. A missing executable is reported as
 * {@link ProcessOutcome.ExecutableNotFound}; any other launch failure as {@link
 * ProcessOutcome.StartFailed}.
 */
@Component
public class ProcessRunner {

  private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

  private static final Pattern MISSING_EXECUTABLE = Pattern.compile("error=2\\b");

  private final ExecutorService streamReaders =
      Executors.newCachedThreadPool(
          new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable runnable) {
              Thread thread = new Thread(runnable, "process-io-" + counter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            }
          });

  /**
   * Runs {@code command} and waits for it to finish.
   *
   * @param command executable followed by its arguments
   * @param workingDirectory directory to run in, or null for the current directory
   * @param timeout maximum wall-clock time
   * @return how the process ended
   */
  public ProcessOutcome run(List<String> command, @Nullable Path workingDirectory, Duration timeout) {
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    String executable = command.get(0);
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDirectory != null) {
      // the OS reports a missing working directory with the same error as a missing executable
      if (!Files.isDirectory(workingDirectory)) {
        log.warn(
            "Cannot start {}: working directory {} does not exist", executable, workingDirectory);
        return new ProcessOutcome.StartFailed(
            executable, "Working directory does not exist: " + workingDirectory);
      }
      builder.directory(workingDirectory.toFile());
    }

    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      if (isMissingExecutable(e)) {
        log.debug("Executable {} not found: {}", executable, e.getMessage());
        return new ProcessOutcome.ExecutableNotFound(executable);
      }
      log.warn("Could not start {}: {}", executable, e.getMessage());
      return new ProcessOutcome.StartFailed(executable, String.valueOf(e.getMessage()));
    }
    log.debug("Started {} (pid {})", command, process.pid());

    try {
      process.getOutputStream().close();
    } catch (IOException e) {
      log.debug("Could not close stdin of {}: {}", executable, e.getMessage());
    }
    CompletableFuture<String> stdout = drain(process.getInputStream());
    CompletableFuture<String> stderr = drain(process.getErrorStream());

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        log.warn("{} timed out after {} and was killed", executable, timeout);
        return new ProcessOutcome.TimedOut(timeout);
      }
      return new ProcessOutcome.Completed(process.exitValue(), stdout.get(), stderr.get());
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for " + executable, e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Failed to read output of " + executable, e.getCause());
    }
  }

  /** The JDK reports ENOENT (ERROR_FILE_NOT_FOUND on Windows) as {@code error=2}. */
  static boolean isMissingExecutable(IOException e) {
    String message = e.getMessage();
    return message != null && MISSING_EXECUTABLE.matcher(message).find();
  }

  @PreDestroy
  void shutdown() {
    streamReaders.shutdownNow();
  }

  private CompletableFuture<String> drain(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        },
        streamReaders);
  }
}
