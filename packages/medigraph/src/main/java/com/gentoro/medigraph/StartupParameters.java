package com.gentoro.medigraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line parameters in {@code --name=value} form. A bare {@code --flag} is stored as
 * {@code "true"}; everything else is collected as positional arguments.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();
  private final List<String> positional = new ArrayList<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null) continue;
      if (arg.startsWith("--") && arg.length() > 2) {
        String body = arg.substring(2);
        int eq = body.indexOf('=');
        if (eq < 0) {
          parameters.put(body.toLowerCase(Locale.ROOT), "true");
        } else {
          parameters.put(body.substring(0, eq).toLowerCase(Locale.ROOT), body.substring(eq + 1));
        }
      } else {
        positional.add(arg);
      }
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    return getParameter(name, type, null);
  }

  public <T> T getParameter(String name, Class<T> type, T defaultValue) {
    String raw = parameters.get(name.toLowerCase(Locale.ROOT));
    if (raw == null) return defaultValue;
    if (type == String.class) return type.cast(raw);
    if (type == Integer.class) return type.cast(Integer.valueOf(raw.trim()));
    if (type == Boolean.class) return type.cast(Boolean.valueOf(raw.trim()));
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name.toLowerCase(Locale.ROOT));
  }

  public List<String> positionalArguments() {
    return Collections.unmodifiableList(positional);
  }

  /** Path given with {@code --config}, or null to use the bundled {@code application.yaml}. */
  public String configFile() {
    return getParameter("config", String.class);
  }
}
