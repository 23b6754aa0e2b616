package com.gentoro.autoreport.exception;

/** Aggregation weights are missing, negative, or do not sum to 1.0. */
public class WeightConfigException extends ConfigurationException {
  public WeightConfigException(String message) {
    super(AutoReportErrorCode.WEIGHT_CONFIG_ERROR, message);
  }
}
