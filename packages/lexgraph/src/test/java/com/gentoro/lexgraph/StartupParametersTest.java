package com.gentoro.lexgraph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lexgraph.exception.ValidationException;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  @DisplayName("defaults apply when only the input is given")
  void defaults() {
    StartupParameters params = new StartupParameters(new String[] {"--xml-path", "usc26.xml"});
    assertEquals("parse", params.mode());
    assertEquals(ConfigurationProvider.DEFAULT_LOCATION, params.configFile());
    assertEquals("usc26.xml", params.getParameter("xml-path", String.class));
    assertFalse(params.isParameterPresent("clear"));
    assertEquals(Optional.empty(), params.getOptionalInt("max-sections"));
  }

  @Test
  @DisplayName("switches take no value and valued options read the next argument")
  void switchesAndValues() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--xml-path", "usc26.xml",
              "--mode", "ingest",
              "--clear",
              "--max-sections", "10",
              "--show-hierarchy",
              "--max-depth", "2",
              "--demo"
            });
    assertEquals("ingest", params.mode());
    assertTrue(params.isParameterPresent("clear"));
    assertTrue(params.isParameterPresent("demo"));
    assertTrue(params.isParameterPresent("show-hierarchy"));
    assertEquals(Optional.of(10), params.getOptionalInt("max-sections"));
    assertEquals(Optional.of(2), params.getOptionalInt("max-depth"));
  }

  @Test
  @DisplayName("help skips validation")
  void help() {
    assertTrue(new StartupParameters(new String[] {"--help"}).isHelp());
  }

  @Test
  @DisplayName("invalid command lines are rejected")
  void invalid() {
    assertThrows(ValidationException.class, () -> new StartupParameters(new String[] {}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--xml-path", "a.xml", "--mode", "load"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--xml-path", "a.xml", "--verbose"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--xml-path", "a.xml", "extra"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--xml-path", "a.xml", "--max-sections", "0"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--xml-path", "a.xml", "--max-depth", "x"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--xml-path", "a.xml", "--output"}));
  }
}
