package com.sundayedge.live.service;

import java.nio.file.Path;
import java.nio.file.Paths;

/** Resolves the configured data directory the same way whether started from the repo root or the module. */
final class DataPathResolver {
  private static final String DEFAULT_DIR = "backend/data";

  private DataPathResolver() {}

  static Path resolve(String configuredDir) {
    String value = configuredDir == null || configuredDir.isBlank() ? DEFAULT_DIR : configuredDir.trim();
    if (value.equals("~") || value.startsWith("~/")) {
      value = System.getProperty("user.home") + value.substring(1);
    }

    Path configured = Paths.get(value).normalize();
    if (configured.isAbsolute()) {
      return configured;
    }
    Path workingDir = Paths.get("").toAbsolutePath().normalize();
    return workingDir.resolve(stripModulePrefix(workingDir, configured)).normalize();
  }

  // backend/data seen from inside backend/ means ./data.
  private static Path stripModulePrefix(Path workingDir, Path relative) {
    Path moduleName = workingDir.getFileName();
    if (moduleName == null || relative.getNameCount() == 0) {
      return relative;
    }
    if (!moduleName.toString().equalsIgnoreCase(relative.getName(0).toString())) {
      return relative;
    }
    return relative.getNameCount() == 1
        ? Paths.get(".")
        : relative.subpath(1, relative.getNameCount());
  }
}
