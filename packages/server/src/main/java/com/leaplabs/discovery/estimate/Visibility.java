package com.leaplabs.discovery.estimate;

import com.leaplabs.discovery.exception.ValidationException;
import java.util.Locale;

/** Who can see a run's results. Public runs are free and published; private runs cost credits. */
public enum Visibility {
  PUBLIC,
  PRIVATE;

  public boolean isPublic() {
    return this == PUBLIC;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Parse the tool-facing value; {@code null} or blank means public. */
  public static Visibility parse(String value) {
    if (value == null || value.isBlank()) {
      return PUBLIC;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "public" -> PUBLIC;
      case "private" -> PRIVATE;
      default -> throw new ValidationException(
          "Invalid visibility '%s'. Must be 'public' or 'private'.".formatted(value));
    };
  }
}
