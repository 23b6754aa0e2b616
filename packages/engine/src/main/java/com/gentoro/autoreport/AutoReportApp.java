package com.gentoro.autoreport;

import com.gentoro.autoreport.orchestrator.ProcessingResult;
import com.gentoro.autoreport.utility.JacksonUtility;

public class AutoReportApp {

  private static final org.slf4j.Logger log =
      com.gentoro.autoreport.logging.LoggingService.getLogger(AutoReportApp.class);

  public static void main(String[] args) {
    try (AutoReport app = new AutoReport(args)) {
      app.initialize();
      ProcessingResult result = app.run();
      System.out.println(JacksonUtility.toPrettyJson(result));
      System.out.println(result.performance().format());
    } catch (Exception e) {
      log.error("Report generation failed", e);
      System.exit(1);
    }
  }
}
