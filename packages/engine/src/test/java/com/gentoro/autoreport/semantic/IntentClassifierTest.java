package com.gentoro.autoreport.semantic;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.autoreport.parser.PlaceholderParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IntentClassifierTest {

  private final PlaceholderParser parser = new PlaceholderParser();
  private final IntentClassifier classifier = new IntentClassifier();

  @Test
  @DisplayName("declared type plus a matching name cue gives full share")
  void declaredAndCue() {
    IntentClassifier.Classification c =
        classifier.classify(parser.parseOne("{{统计：销售额}}"), "");
    assertEquals(Intent.STATISTIC, c.intent());
    assertEquals(0.8, c.confidence(), 1e-9);
  }

  @Test
  @DisplayName("conflicting cues lower the confidence")
  void conflictingCues() {
    IntentClassifier.Classification c =
        classifier.classify(parser.parseOne("{{统计：销售额趋势}}"), "");
    assertEquals(Intent.STATISTIC, c.intent());
    assertEquals(0.64, c.confidence(), 1e-9);
    assertEquals(0.2, c.scores().get(Intent.TREND), 1e-9);
  }

  @Test
  @DisplayName("strong cues can override the declared type")
  void cuesOverride() {
    IntentClassifier.Classification c =
        classifier.classify(parser.parseOne("{{统计：最高最大最多峰值销量}}"), "");
    assertEquals(Intent.EXTREMUM, c.intent());
  }

  @Test
  @DisplayName("declared type wins a tie")
  void tieGoesToDeclared() {
    IntentClassifier.Classification c =
        classifier.classify(parser.parseOne("{{区域：趋势变化走势}}"), "");
    assertEquals(Intent.REGION, c.intent());
  }

  @Test
  @DisplayName("neighborhood cues count less than name cues")
  void neighborhood() {
    IntentClassifier.Classification c =
        classifier.classify(parser.parseOne("{{统计：销售额}}"), "本季度同比变化趋势");
    assertEquals(Intent.STATISTIC, c.intent());
    assertTrue(c.scores().get(Intent.TREND) < IntentClassifier.NAME_CUE_SCORE);
    assertTrue(c.confidence() < 0.8);
  }
}
