// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;

/// Settings for a [JulNodeLog].
///
/// @param enabled whether lines are written at all. This can be flipped later with [JulNodeLog#enable()].
/// @param logFile when present lines go to this file instead of the console.
/// @param level   the JUL level of the node logger.
public record NodeLogConfig(boolean enabled, Optional<Path> logFile, Level level) {
  public static final String ENABLED_PROPERTY = "dr_ones.log.enabled";
  public static final String FILE_PROPERTY = "dr_ones.log.file";
  public static final String LEVEL_PROPERTY = "dr_ones.log.level";

  public static final String ENABLED_ENV = "DR_ONES_LOG_ENABLED";
  public static final String FILE_ENV = "DR_ONES_LOG_FILE";
  public static final String LEVEL_ENV = "LOG_LEVEL";

  public NodeLogConfig {
    Objects.requireNonNull(logFile, "logFile cannot be null use Optional.empty()");
    Objects.requireNonNull(level, "level cannot be null");
  }

  public static NodeLogConfig defaults() {
    return new NodeLogConfig(true, Optional.empty(), Level.INFO);
  }

  /// Reads the system properties first and then the environment.
  public static NodeLogConfig fromSystem() {
    return from(System::getProperty, System::getenv);
  }

  static NodeLogConfig from(Function<String, String> properties, Function<String, String> environment) {
    final var enabled = lookup(properties, environment, ENABLED_PROPERTY, ENABLED_ENV)
        .map(Boolean::parseBoolean)
        .orElse(true);
    final var file = lookup(properties, environment, FILE_PROPERTY, FILE_ENV)
        .map(Path::of);
    final var level = lookup(properties, environment, LEVEL_PROPERTY, LEVEL_ENV)
        .map(Level::parse)
        .orElse(Level.INFO);
    return new NodeLogConfig(enabled, file, level);
  }

  private static Optional<String> lookup(Function<String, String> properties,
                                         Function<String, String> environment,
                                         String property,
                                         String env) {
    return Optional.ofNullable(properties.apply(property))
        .or(() -> Optional.ofNullable(environment.apply(env)))
        .map(String::trim)
        .filter(s -> !s.isEmpty());
  }
}
