package com.leaplabs.discovery.estimate;

import static org.junit.jupiter.api.Assertions.*;

import com.leaplabs.discovery.exception.ValidationException;
import org.junit.jupiter.api.Test;

class VisibilityTest {

  @Test
  void missingValueMeansPublic() {
    assertEquals(Visibility.PUBLIC, Visibility.parse(null));
    assertEquals(Visibility.PUBLIC, Visibility.parse("  "));
  }

  @Test
  void parsesCaseInsensitively() {
    assertEquals(Visibility.PRIVATE, Visibility.parse("Private"));
    assertEquals("private", Visibility.PRIVATE.wireName());
  }

  @Test
  void rejectsUnknownValues() {
    assertThrows(ValidationException.class, () -> Visibility.parse("secret"));
  }
}
