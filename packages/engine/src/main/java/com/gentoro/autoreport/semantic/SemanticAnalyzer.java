package com.gentoro.autoreport.semantic;

import com.gentoro.autoreport.context.BusinessContext;
import com.gentoro.autoreport.context.DocumentContext;
import com.gentoro.autoreport.context.PlaceholderLocation;
import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Classifies intent, recognizes entities and infers parameters for one placeholder. Pure
 * in-process work; safe to call concurrently.
 */
public class SemanticAnalyzer {
  private static final Logger log = LoggingService.getLogger(SemanticAnalyzer.class);

  private final double minConfidence;
  private final EntityRecognizer recognizer;
  private final IntentClassifier classifier;
  private final ImplicitParameterInferencer inferencer;

  public SemanticAnalyzer(double minConfidence) {
    this(minConfidence, new EntityRecognizer(), new IntentClassifier());
  }

  public SemanticAnalyzer(
      double minConfidence, EntityRecognizer recognizer, IntentClassifier classifier) {
    this.minConfidence = minConfidence;
    this.recognizer = recognizer;
    this.classifier = classifier;
    this.inferencer = new ImplicitParameterInferencer(recognizer);
  }

  public SemanticAnalysis analyze(
      PlaceholderSpec spec, DocumentContext document, BusinessContext business) {
    DocumentContext doc = document == null ? DocumentContext.empty() : document;
    BusinessContext biz = business == null ? BusinessContext.empty() : business;

    String name = spec.displayName();
    String neighborhood = neighborhood(spec, doc);

    List<RecognizedEntity> nameEntities = recognizer.recognizeName(name);
    List<RecognizedEntity> entities = new ArrayList<>(nameEntities);
    entities.addAll(recognizer.recognizeNeighborhood(neighborhood));

    IntentClassifier.Classification c = classifier.classify(spec, neighborhood);
    boolean low = c.confidence() < minConfidence;
    if (low) {
      log.warn(
          "Low intent confidence {} (< {}) for placeholder '{}', classified as {}",
          c.confidence(),
          minConfidence,
          name,
          c.intent());
    }

    List<InferredParameter> params = inferencer.infer(spec, c.intent(), nameEntities, doc, biz);
    log.debug(
        "Placeholder '{}' -> intent {} ({}), {} parameters",
        name,
        c.intent(),
        c.confidence(),
        params.size());
    return new SemanticAnalysis(
        c.intent(), c.confidence(), low, params, entities, metric(name, nameEntities));
  }

  /**
   * Minimal analysis used when semantic analysis is disabled: the declared type maps directly to
   * the intent, only explicit parameters and per-intent defaults are kept.
   */
  public SemanticAnalysis declaredOnly(PlaceholderSpec spec, DocumentContext document) {
    DocumentContext doc = document == null ? DocumentContext.empty() : document;
    Intent intent = Intent.fromType(spec.type());
    List<RecognizedEntity> nameEntities = recognizer.recognizeName(spec.displayName());
    List<InferredParameter> params =
        inferencer.infer(spec, intent, List.of(), doc, BusinessContext.empty());
    double confidence = intent == Intent.UNKNOWN ? 0.0 : IntentClassifier.DECLARED_SCORE;
    return new SemanticAnalysis(
        intent,
        confidence,
        confidence < minConfidence,
        params,
        nameEntities,
        metric(spec.displayName(), nameEntities));
  }

  private static String neighborhood(PlaceholderSpec spec, DocumentContext doc) {
    Optional<PlaceholderLocation> location = doc.locate(spec);
    if (location.isEmpty()) {
      return "";
    }
    PlaceholderLocation loc = location.get();
    String text = loc.paragraph() != null ? loc.paragraph().text() : loc.section().heading();
    // the token itself would otherwise feed its own cues back in
    return spec.rawText() == null ? text : text.replace(spec.rawText(), " ");
  }

  private static String metric(String name, List<RecognizedEntity> nameEntities) {
    return nameEntities.stream()
        .filter(e -> e.type() == EntityType.METRIC)
        .map(RecognizedEntity::text)
        .findFirst()
        .orElse(name);
  }
}
