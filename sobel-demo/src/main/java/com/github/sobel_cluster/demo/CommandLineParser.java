// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.demo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Splits `--name value`, `--name=value`, `-n value` and bare flags from positional arguments.
class CommandLineParser {
  private final Map<String, String> options = new HashMap<>();
  private final List<String> remainingArgs = new ArrayList<>();

  void parse(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];

      if (arg.startsWith("--")) {
        String option = arg.substring(2);
        if (option.contains("=")) {
          String[] parts = option.split("=", 2);
          options.put(parts[0], parts[1]);
        } else if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
          options.put(option, args[++i]);
        } else {
          options.put(option, "true");
        }
      } else if (arg.startsWith("-") && arg.length() > 1) {
        String option = arg.substring(1);
        if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
          options.put(option, args[++i]);
        } else {
          options.put(option, "true");
        }
      } else {
        remainingArgs.add(arg);
      }
    }
  }

  Optional<String> option(String name) {
    return Optional.ofNullable(options.get(name));
  }

  boolean hasOption(String name) {
    return options.containsKey(name);
  }

  /// @throws IllegalArgumentException if the option is present but is not a non-negative integer
  Optional<Integer> nonNegativeInt(String name) {
    return option(name).map(value -> {
      final int parsed;
      try {
        parsed = Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("--" + name + " expects a number but got '" + value + "'", e);
      }
      if (parsed < 0) {
        throw new IllegalArgumentException("--" + name + " cannot be negative: " + parsed);
      }
      return parsed;
    });
  }

  List<String> remainingArgs() {
    return remainingArgs;
  }
}
