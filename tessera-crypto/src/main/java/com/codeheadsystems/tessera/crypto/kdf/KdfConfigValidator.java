package com.codeheadsystems.tessera.crypto.kdf;

import com.codeheadsystems.tessera.crypto.common.DeploymentMode;
import com.codeheadsystems.tessera.crypto.exceptions.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup validation of KDF cost parameters.
 * <p>
 * Argon2id memory exponent must lie in [12,18] and time cost in [2,10]. Outside that range
 * startup fails in production and logs a warning otherwise.
 */
public class KdfConfigValidator {

  private static final Logger log = LoggerFactory.getLogger(KdfConfigValidator.class);

  public static final int MIN_MEMORY_EXPONENT = 12;
  public static final int MAX_MEMORY_EXPONENT = 18;
  public static final int HIGH_MEMORY_EXPONENT = 17;
  public static final int MIN_TIME_COST = 2;
  public static final int MAX_TIME_COST = 10;

  private KdfConfigValidator() {
  }

  /**
   * Builds the report without logging or failing.
   *
   * @param parameters the parameters
   * @param mode       the deployment mode
   * @return the report
   */
  public static KdfConfigReport report(KdfParameters parameters, DeploymentMode mode) {
    List<String> warnings = new ArrayList<>();
    List<String> recommendations = new ArrayList<>();
    boolean withinBounds = true;

    if (parameters.algorithm() == KdfAlgorithm.PBKDF2_SHA256) {
      if (mode.isProduction()) {
        recommendations.add("PBKDF2 fallback is active; deploy an Argon2id capable provider");
      }
      return new KdfConfigReport(parameters, 0, warnings, recommendations, true);
    }

    int exponent = parameters.memoryExponent();
    long memoryMib = parameters.memoryKib() / 1024;
    if (exponent < MIN_MEMORY_EXPONENT) {
      warnings.add("Memory exponent " + exponent + " is too low for security (minimum "
          + MIN_MEMORY_EXPONENT + ")");
      withinBounds = false;
    } else if (exponent > MAX_MEMORY_EXPONENT) {
      warnings.add("Memory exponent " + exponent + " is very high and may exhaust memory (maximum "
          + MAX_MEMORY_EXPONENT + ")");
      withinBounds = false;
    } else if (exponent > HIGH_MEMORY_EXPONENT) {
      warnings.add("Memory exponent " + exponent + " (" + memoryMib
          + " MiB) is high; monitor for out-of-memory errors");
    }
    if (parameters.timeCost() < MIN_TIME_COST || parameters.timeCost() > MAX_TIME_COST) {
      warnings.add("Time cost " + parameters.timeCost() + " is outside [" + MIN_TIME_COST + ","
          + MAX_TIME_COST + "]");
      withinBounds = false;
    }

    if (mode.isProduction()) {
      if (exponent < 16) {
        recommendations.add("Use a memory exponent of at least 16 (64 MiB) in production");
      }
      if (exponent > HIGH_MEMORY_EXPONENT) {
        recommendations.add("Consider memory exponent 17 (128 MiB) for constrained hosts");
      }
    } else if (exponent > 15) {
      recommendations.add("Consider memory exponent 15 (32 MiB) for faster development cycles");
    }
    return new KdfConfigReport(parameters, memoryMib, warnings, recommendations, withinBounds);
  }

  /**
   * Logs the report and enforces the range.
   *
   * @param parameters the parameters
   * @param mode       the deployment mode
   * @return the report
   * @throws ConfigurationException in production when a value is out of range
   */
  public static KdfConfigReport validateOnStartup(KdfParameters parameters, DeploymentMode mode) {
    KdfConfigReport report = report(parameters, mode);
    log.info("KDF configuration: {} ({} MiB), mode={}", parameters.encode(), report.memoryMib(), mode);
    report.warnings().forEach(w -> log.warn("KDF configuration warning: {}", w));
    report.recommendations().forEach(r -> log.info("KDF configuration recommendation: {}", r));
    if (!report.withinBounds()) {
      if (mode.isProduction()) {
        throw new ConfigurationException("Invalid KDF configuration: " + String.join("; ", report.warnings()));
      }
      log.warn("KDF parameters are outside the supported range. Do not use in production.");
    }
    return report;
  }
}
