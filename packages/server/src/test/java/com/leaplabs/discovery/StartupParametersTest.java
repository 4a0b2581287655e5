package com.leaplabs.discovery;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToStdioAndClasspathConfig() {
    StartupParameters params = new StartupParameters(new String[] {});
    assertEquals("stdio", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
  }

  @Test
  void parsesModeAndConfigFile() {
    StartupParameters params =
        new StartupParameters(new String[] {"--mode", "server", "--config-file", "/etc/d.yaml"});
    assertEquals("server", params.mode());
    assertEquals("/etc/d.yaml", params.configFile());
  }

  @Test
  void flagWithoutValueDoesNotSwallowTheNextFlag() {
    StartupParameters params = new StartupParameters(new String[] {"--verbose", "--mode", "help"});
    assertTrue(params.isParameterPresent("verbose"));
    assertEquals("help", params.mode());
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "interactive"}));
  }
}
