package dev.changetriggers.core;

public final class DispatchStateChange {
  private final DispatchLoopState previousState;
  private final DispatchLoopState state;
  private final Throwable cause;
  private final long attempt;

  public DispatchStateChange(DispatchLoopState previousState,
                             DispatchLoopState state,
                             Throwable cause,
                             long attempt) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
  }

  public DispatchLoopState previousState() {
    return previousState;
  }

  public DispatchLoopState state() {
    return state;
  }

  /**
   * The error that caused this transition, if any.
   */
  public Throwable cause() {
    return cause;
  }

  /**
   * Session attempt the transition belongs to; {@code 0} outside of a session.
   */
  public long attempt() {
    return attempt;
  }

  @Override
  public String toString() {
    return previousState + " -> " + state + (cause == null ? "" : " (" + cause + ")");
  }
}
