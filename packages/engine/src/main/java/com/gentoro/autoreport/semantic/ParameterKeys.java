package com.gentoro.autoreport.semantic;

import java.util.Locale;
import java.util.Map;

/** Canonical parameter keys and the aliases accepted in markup. */
public final class ParameterKeys {
  public static final String TIME_RANGE = "时间范围";
  public static final String AGGREGATION = "聚合方式";
  public static final String GRANULARITY = "时间粒度";
  public static final String COMPARE_PERIOD = "对比期";
  public static final String LIMIT = "数量";
  public static final String ORDER = "排序";
  public static final String EXTREMUM = "极值类型";
  public static final String CHART_TYPE = "图表类型";
  public static final String HORIZON = "预测期间";
  public static final String REGION = "地区";
  public static final String GROUP_BY = "分组";
  public static final String DOMAIN = "业务领域";

  private static final Map<String, String> ALIASES =
      Map.ofEntries(
          Map.entry("time_range", TIME_RANGE),
          Map.entry("time", TIME_RANGE),
          Map.entry("period", TIME_RANGE),
          Map.entry("时间", TIME_RANGE),
          Map.entry("aggregation", AGGREGATION),
          Map.entry("agg", AGGREGATION),
          Map.entry("granularity", GRANULARITY),
          Map.entry("粒度", GRANULARITY),
          Map.entry("compare_period", COMPARE_PERIOD),
          Map.entry("limit", LIMIT),
          Map.entry("top", LIMIT),
          Map.entry("order", ORDER),
          Map.entry("extremum", EXTREMUM),
          Map.entry("chart_type", CHART_TYPE),
          Map.entry("horizon", HORIZON),
          Map.entry("region", REGION),
          Map.entry("区域", REGION),
          Map.entry("group_by", GROUP_BY),
          Map.entry("domain", DOMAIN));

  private ParameterKeys() {}

  /** Map an alias to its canonical key; unknown keys are returned trimmed. */
  public static String canonical(String key) {
    if (key == null) {
      return null;
    }
    String trimmed = key.trim();
    return ALIASES.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
  }
}
