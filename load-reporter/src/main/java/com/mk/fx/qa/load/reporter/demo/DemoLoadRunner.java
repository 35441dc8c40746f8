package com.mk.fx.qa.load.reporter.demo;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.load.reporter.cfg.ReporterProperties;
import com.mk.fx.qa.load.reporter.context.ThreadLocalExecutionContext;
import com.mk.fx.qa.load.reporter.events.LoadEventBus;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Generates synthetic request outcomes so the reporter can be exercised without a real load
 * engine. Each virtual user runs on its own thread, bound to its execution context id, and fires
 * one notification per simulated request. Quitting is fired once every user is done.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "load.reporter.demo", name = "enabled", havingValue = "true")
public class DemoLoadRunner implements CommandLineRunner {

  private static final List<String> PATHS = List.of("/", "/items", "/items/42", "/checkout");

  private final LoadEventBus bus;
  private final ThreadLocalExecutionContext executionContext;
  private final ReporterProperties.Demo demo;

  public DemoLoadRunner(
      LoadEventBus bus,
      ThreadLocalExecutionContext executionContext,
      ReporterProperties properties) {
    this.bus = bus;
    this.executionContext = executionContext;
    this.demo = properties.getDemo();
  }

  @Override
  public void run(String... args) throws Exception {
    log.info(
        "Demo load starting: users={}, iterations={}, failureRate={}",
        demo.getUsers(),
        demo.getIterations(),
        demo.getFailureRate());

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("demo-user-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    var executor = newFixedThreadPool(demo.getUsers(), threadFactory);
    List<Future<?>> users = new ArrayList<>();
    try {
      for (int userIndex = 0; userIndex < demo.getUsers(); userIndex++) {
        final var currentUser = userIndex;
        users.add(executor.submit(() -> runUser(currentUser)));
      }
      for (Future<?> user : users) {
        try {
          user.get();
        } catch (ExecutionException e) {
          log.warn("Demo user failed: {}", e.getCause().toString());
        }
      }
    } finally {
      executor.shutdownNow();
      executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    log.info("Demo load finished");
    bus.fireQuitting();
  }

  private void runUser(int userIndex) {
    try (var ignored = executionContext.bind(userIndex)) {
      for (int iteration = 0; iteration < demo.getIterations(); iteration++) {
        if (Thread.currentThread().isInterrupted()) {
          return;
        }
        simulateRequest();
      }
    }
  }

  private void simulateRequest() {
    var random = ThreadLocalRandom.current();
    var path = PATHS.get(random.nextInt(PATHS.size()));
    var latencyMs = random.nextLong(5, 50);
    try {
      TimeUnit.MILLISECONDS.sleep(latencyMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return;
    }
    if (random.nextDouble() < demo.getFailureRate()) {
      bus.fireRequestFailure("GET", path, latencyMs, new IOException("HTTP 503 from " + path));
    } else {
      bus.fireRequestSuccess("GET", path, latencyMs, random.nextInt(200, 4096));
    }
  }
}
