package io.restfulobjects.e2e.hooks;

import io.cucumber.java.AfterAll;
import io.cucumber.java.BeforeAll;
import io.restfulobjects.client.ObjectsClient;
import io.restfulobjects.e2e.config.EnvironmentConfig;
import io.restfulobjects.e2e.config.EnvironmentConfig.HarnessSettings;
import io.restfulobjects.e2e.support.TestDataLoader;
import java.util.Objects;
import org.junit.jupiter.api.Assumptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the client and fixture loader shared by every scenario of a run.
 */
public final class LifecycleHooks {

  private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleHooks.class);

  private static volatile Harness harness;
  private static volatile String unavailableReason = "harness hooks have not run";

  private LifecycleHooks() {
  }

  @BeforeAll
  public static void beforeAll() {
    HarnessSettings settings;
    try {
      settings = EnvironmentConfig.loadHarnessSettings();
    } catch (IllegalStateException ex) {
      unavailableReason = ex.getMessage();
      LOGGER.warn("Objects API harness misconfigured: {}", ex.getMessage());
      return;
    }
    if (!settings.liveTestsEnabled()) {
      unavailableReason = "set " + EnvironmentConfig.OBJECTS_E2E_ENABLED + "=true to run against " + settings.baseUrl();
      LOGGER.info("Objects API scenarios disabled: {}", unavailableReason);
      return;
    }
    ObjectsClient client = ObjectsClient.builder()
        .baseUrl(settings.baseUrl())
        .timeout(settings.httpTimeout())
        .build();
    harness = new Harness(settings, client, TestDataLoader.from(settings.testDataDirectory()));
    LOGGER.info("Starting objects API harness with settings: {}", settings.asMap());
  }

  @AfterAll
  public static void afterAll() {
    if (harness != null) {
      LOGGER.info("Stopping objects API harness for {}", harness.settings().baseUrl());
    }
    harness = null;
  }

  /**
   * Returns the shared harness, skipping the calling scenario when live runs are not configured.
   */
  public static Harness requireHarness() {
    Harness current = harness;
    Assumptions.assumeTrue(current != null, () -> "Skipping objects API scenario: " + unavailableReason);
    return current;
  }

  public record Harness(HarnessSettings settings, ObjectsClient client, TestDataLoader testData) {

    public Harness {
      Objects.requireNonNull(settings, "settings");
      Objects.requireNonNull(client, "client");
      Objects.requireNonNull(testData, "testData");
    }
  }
}
