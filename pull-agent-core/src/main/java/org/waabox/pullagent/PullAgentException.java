package org.waabox.pullagent;

/**
 * Base exception for all pull-agent infrastructure errors.
 *
 * <p>This is an unchecked exception intended to wrap startup and transport
 * failures that cannot be meaningfully recovered from at the call site,
 * such as failing to join the cluster or to bind the proxy port.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PullAgentException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public PullAgentException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public PullAgentException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
