package com.gentoro.autoreport.semantic;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EntityRecognizerTest {

  private final EntityRecognizer recognizer = new EntityRecognizer();

  @Test
  @DisplayName("time, location and metric are found with spans")
  void mixedEntities() {
    List<RecognizedEntity> entities = recognizer.recognizeName("2024年3月华东地区销售额");
    assertEquals(3, entities.size(), entities::toString);

    RecognizedEntity time = entities.get(0);
    assertEquals(EntityType.TIME, time.type());
    assertEquals("2024年3月", time.text());
    assertEquals(0, time.start());
    assertEquals(7, time.end());
    assertTrue(time.fromName());

    assertEquals(EntityType.LOCATION, entities.get(1).type());
    assertEquals("华东地区", entities.get(1).text());
    assertEquals(EntityType.METRIC, entities.get(2).type());
    assertEquals("销售额", entities.get(2).text());
  }

  @Test
  @DisplayName("overlapping matches keep the longest at the same start")
  void longestMatchWins() {
    List<RecognizedEntity> entities = recognizer.recognizeNeighborhood("2024-03-15 的订单金额");
    assertEquals("2024-03-15", entities.get(0).text());
    assertFalse(entities.get(0).fromName());
    assertTrue(entities.stream().anyMatch(e -> e.text().equals("订单金额")));
    assertTrue(entities.stream().noneMatch(e -> e.text().equals("金额")));
  }

  @Test
  @DisplayName("relative periods and English metrics are recognized")
  void relativeAndEnglish() {
    List<RecognizedEntity> entities = recognizer.recognizeName("revenue for last month");
    assertTrue(entities.stream().anyMatch(e -> e.type() == EntityType.METRIC));
    assertTrue(
        entities.stream()
            .anyMatch(e -> e.type() == EntityType.TIME && e.text().equals("last month")));
    assertEquals(
        EntityType.TIME, recognizer.recognizeName("近30天订单数").get(0).type());
  }

  @Test
  @DisplayName("blank text yields nothing")
  void blank() {
    assertTrue(recognizer.recognizeName("  ").isEmpty());
    assertTrue(recognizer.recognizeNeighborhood(null).isEmpty());
  }
}
