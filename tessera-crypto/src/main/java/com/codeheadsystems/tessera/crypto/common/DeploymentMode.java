package com.codeheadsystems.tessera.crypto.common;

/**
 * Deployment mode. Production turns configuration warnings into startup failures
 * and keeps one-time codes out of every response.
 */
public enum DeploymentMode {
  DEVELOPMENT,
  PRODUCTION;

  /**
   * Parses a mode name, case-insensitively.
   *
   * @param name the name
   * @return the mode
   */
  public static DeploymentMode fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Deployment mode is required");
    }
    for (DeploymentMode mode : values()) {
      if (mode.name().equalsIgnoreCase(name.trim())) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown deployment mode: " + name);
  }

  public boolean isProduction() {
    return this == PRODUCTION;
  }
}
