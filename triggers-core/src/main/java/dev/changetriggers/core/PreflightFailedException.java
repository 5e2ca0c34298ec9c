package dev.changetriggers.core;

import java.util.Objects;

/**
 * Thrown through the {@code start()} future when preflight reports at least one error.
 */
public final class PreflightFailedException extends IllegalStateException {

  private final PreflightReport report;

  public PreflightFailedException(PreflightReport report) {
    super(Objects.requireNonNull(report, "report").describeFailure());
    this.report = report;
  }

  public PreflightReport report() {
    return report;
  }
}
