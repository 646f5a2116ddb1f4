package io.intellixity.datastore.actions;

/** Raised by {@link ActionDispatcher} for action names it does not serve. */
public final class UnknownActionException extends RuntimeException {
  private final String action;

  public UnknownActionException(String action) {
    super("Unknown action: " + action);
    this.action = action;
  }

  public String action() {
    return action;
  }
}
