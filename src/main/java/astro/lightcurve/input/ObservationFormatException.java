package astro.lightcurve.input;

import java.io.IOException;

/**
 * Thrown when an observation record or the data table it references does not have the expected
 * layout: an unsupported number of columns, an unknown magnitude/flux flag, a missing column or
 * an unparseable or non-finite value.
 */
public class ObservationFormatException extends IOException {

  private static final long serialVersionUID = 1L;

  public ObservationFormatException(String message) {
    super(message);
  }

  public ObservationFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
