package com.gentoro.autoreport.parser;

/** One {@code KEY=VALUE} segment of a placeholder, in source order. */
public record Parameter(String key, ParameterValue value) {}
