package dev.changetriggers.core;

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides whether the dispatch loop reopens a replication session after it failed, and how long
 * it waits first. The default is {@link #disabled()}: a failed session stops the loop.
 */
public final class ReconnectPolicy {
  private Duration initialDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofSeconds(30);
  private double multiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxAttempts = 0;
  private final boolean enabled;

  private ReconnectPolicy(boolean enabled) {
    this.enabled = enabled;
  }

  public static ReconnectPolicy disabled() {
    return new ReconnectPolicy(false);
  }

  /**
   * Bounded exponential backoff with jitter. {@code maxAttempts = 0} reconnects indefinitely.
   */
  public static ReconnectPolicy exponentialBackoff() {
    return new ReconnectPolicy(true);
  }

  public static ReconnectPolicy fromJson(JsonObject json) {
    if (json == null || !json.getBoolean("enabled", true)) {
      return disabled();
    }
    ReconnectPolicy policy = exponentialBackoff();
    policy.initialDelay = Duration.ofMillis(json.getLong("initialDelayMs", policy.initialDelay.toMillis()));
    policy.maxDelay = Duration.ofMillis(json.getLong("maxDelayMs", policy.maxDelay.toMillis()));
    policy.multiplier = json.getDouble("multiplier", policy.multiplier);
    policy.setJitter(json.getDouble("jitter", policy.jitter));
    policy.maxAttempts = json.getLong("maxAttempts", policy.maxAttempts);
    return policy;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("enabled", enabled)
      .put("initialDelayMs", initialDelay.toMillis())
      .put("maxDelayMs", maxDelay.toMillis())
      .put("multiplier", multiplier)
      .put("jitter", jitter)
      .put("maxAttempts", maxAttempts);
  }

  public ReconnectPolicy copy() {
    ReconnectPolicy copy = new ReconnectPolicy(enabled);
    copy.initialDelay = initialDelay;
    copy.maxDelay = maxDelay;
    copy.multiplier = multiplier;
    copy.jitter = jitter;
    copy.maxAttempts = maxAttempts;
    return copy;
  }

  public ReconnectPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public ReconnectPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public ReconnectPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  public ReconnectPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  public ReconnectPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * @param failedAttempts number of consecutive session attempts that have failed so far
   */
  public boolean shouldReconnect(long failedAttempts) {
    if (!enabled) {
      return false;
    }
    return maxAttempts == 0 || failedAttempts < maxAttempts;
  }

  public long delayMillis(long failedAttempts) {
    double base = initialDelay.toMillis() * Math.pow(Math.max(1.0d, multiplier), Math.max(0, failedAttempts - 1));
    long capped = Math.min((long) base, maxDelay.toMillis());
    if (jitter == 0.0d || capped == 0L) {
      return capped;
    }
    long delta = (long) (capped * jitter);
    return ThreadLocalRandom.current().nextLong(Math.max(0L, capped - delta), capped + delta + 1);
  }

  public void validate() {
    if (initialDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("reconnect delays must be >= 0");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0");
    }
  }
}
