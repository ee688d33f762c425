package com.gentoro.lexgraph;

import com.gentoro.lexgraph.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line arguments in {@code --name value} form. Switches such as {@code --clear} take no
 * value: a name followed by another {@code --name} (or by nothing) is recorded with a {@code null}
 * value and checked with {@link #isParameterPresent(String)}.
 */
public class StartupParameters {

  private static final Set<String> SWITCHES =
      Set.of("show-hierarchy", "clear", "dry-run", "demo", "help");

  private static final Set<String> KNOWN =
      Set.of(
          "xml-path",
          "mode",
          "max-sections",
          "output",
          "show-hierarchy",
          "max-depth",
          "show-section",
          "clear",
          "dry-run",
          "demo",
          "config-file",
          "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "parse"); // parse, ingest
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        throw new ValidationException("Unexpected argument: " + arguments[p]);
      }

      String paramName = arguments[p].substring(2);
      if (!KNOWN.contains(paramName)) {
        throw new ValidationException("Unknown option: --" + paramName);
      }
      String paramValue = null;

      if (!SWITCHES.contains(paramName)
          && p < arguments.length - 1
          && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    if (isHelp()) {
      return;
    }
    Object mode = parameters.get("mode");
    if (!"parse".equals(mode) && !"ingest".equals(mode)) {
      throw new ValidationException("Invalid mode: " + mode);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new ValidationException("Missing config file location");
    }

    if (parameters.get("xml-path") == null || parameters.get("xml-path").toString().isBlank()) {
      throw new ValidationException("Missing required option --xml-path");
    }

    for (String name : new String[] {"output", "show-section"}) {
      if (parameters.containsKey(name) && parameters.get(name) == null) {
        throw new ValidationException("Option --" + name + " requires a value");
      }
    }
    getOptionalInt("max-sections");
    getOptionalInt("max-depth");
  }

  public boolean isHelp() {
    return parameters.containsKey("help");
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/lexgraph.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class)
        .orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  /** Positive integer option; empty when absent. */
  public Optional<Integer> getOptionalInt(String name) {
    Object raw = parameters.get(name);
    if (raw == null) {
      if (parameters.containsKey(name)) {
        throw new ValidationException("Option --" + name + " requires a value");
      }
      return Optional.empty();
    }
    try {
      int value = Integer.parseInt(raw.toString().trim());
      if (value <= 0) {
        throw new ValidationException("Option --" + name + " must be positive: " + raw);
      }
      return Optional.of(value);
    } catch (NumberFormatException e) {
      throw new ValidationException("Option --" + name + " is not a number: " + raw, e);
    }
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        System.lineSeparator(),
        "Usage: lexgraph --xml-path <file> [options]",
        "  --mode parse|ingest      parse only (default) or parse and load into the graph store",
        "  --max-sections N         stop materializing sections after N",
        "  --output <file>          export the parsed hierarchy as JSON",
        "  --show-hierarchy         print the unit hierarchy",
        "  --max-depth N            depth limit for --show-hierarchy (default 3)",
        "  --show-section <num>     print details for one section, e.g. 162",
        "  --clear                  clear the graph store before loading (ingest mode)",
        "  --dry-run                project the graph without touching the store (ingest mode)",
        "  --demo                   run sample queries after loading (ingest mode)",
        "  --config-file <loc>      configuration location (default classpath:application.yaml)",
        "  --help                   print this message");
  }
}
