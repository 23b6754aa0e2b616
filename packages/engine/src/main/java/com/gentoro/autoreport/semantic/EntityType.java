package com.gentoro.autoreport.semantic;

public enum EntityType {
  TIME,
  LOCATION,
  METRIC
}
