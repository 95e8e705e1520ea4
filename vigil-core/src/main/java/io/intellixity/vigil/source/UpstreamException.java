package io.intellixity.vigil.source;

/**
 * Raised when an upstream monitoring API call fails.\n
 *
 * {@link #status()} is the upstream's HTTP status when it answered, 500 when it could not be
 * reached or its payload could not be read.
 */
public final class UpstreamException extends RuntimeException {
  public static final int DEFAULT_STATUS = 500;

  private final int status;

  public UpstreamException(String message, int status) {
    super(message);
    this.status = status;
  }

  public UpstreamException(String message, int status, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public int status() {
    return status;
  }
}
