package dev.changetriggers.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of checking a source database before replication starts.
 */
public final class PreflightReport {

  public enum Severity {
    ERROR,
    WARNING
  }

  public static final class Issue {
    private final Severity severity;
    private final String code;
    private final String message;
    private final String remediation;

    public Issue(Severity severity, String code, String message, String remediation) {
      this.severity = Objects.requireNonNull(severity, "severity");
      this.code = Objects.requireNonNull(code, "code");
      this.message = Objects.requireNonNull(message, "message");
      this.remediation = remediation;
    }

    public Severity severity() {
      return severity;
    }

    public String code() {
      return code;
    }

    public String message() {
      return message;
    }

    public String remediation() {
      return remediation;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append('[').append(code).append("] ").append(message);
      if (remediation != null && !remediation.isBlank()) {
        sb.append(" Remediation: ").append(remediation);
      }
      return sb.toString();
    }
  }

  private final List<Issue> issues;

  public PreflightReport(List<Issue> issues) {
    Objects.requireNonNull(issues, "issues");
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  public boolean ok() {
    return issues.stream().noneMatch(issue -> issue.severity() == Severity.ERROR);
  }

  public List<Issue> issues() {
    return issues;
  }

  public String describeFailure() {
    return "Preflight failed: " + issues.stream()
      .filter(issue -> issue.severity() == Severity.ERROR)
      .map(Issue::toString)
      .collect(Collectors.joining("; "));
  }
}
