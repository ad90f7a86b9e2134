package com.quantori.crp.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.crp.api.ChargeNotation;
import com.quantori.crp.api.Molecule;
import com.quantori.crp.api.Phase;
import com.quantori.crp.api.ValidationException;
import com.quantori.crp.core.ReactionEngine;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts reactions to {@link ReactionDocument}s and JSON and back.
 */
public class ReactionJsonSerDe {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final ReactionEngine engine;

  public ReactionJsonSerDe() {
    this(ReactionEngine.defaultEngine());
  }

  public ReactionJsonSerDe(ReactionEngine engine) {
    this.engine = engine;
  }

  public ReactionDocument toDocument(Reaction reaction) {
    ReactionDocument document = new ReactionDocument();
    document.setName(reaction.getName());
    document.setReactants(reaction.getReactants().stream()
        .map(ReactionJsonSerDe::toComponentDocument)
        .collect(Collectors.toList()));
    document.setProducts(reaction.getProducts().stream()
        .map(ReactionJsonSerDe::toComponentDocument)
        .collect(Collectors.toList()));
    document.setTemperature(reaction.getTemperature());
    document.setPressure(reaction.getPressure());
    document.setConditions(new LinkedHashMap<>(reaction.getConditions()));
    document.setBalanced(reaction.isBalanced());
    return document;
  }

  /**
   * Rebuilds a reaction from a document.
   *
   * @param document reaction document
   * @return new reaction bound to this serde's engine
   * @throws ValidationException if a formula, coefficient or phase is invalid
   */
  public Reaction fromDocument(ReactionDocument document) {
    Reaction reaction = engine.newReaction();
    reaction.setName(document.getName());
    reaction.setTemperature(document.getTemperature());
    reaction.setPressure(document.getPressure());
    if (document.getConditions() != null) {
      document.getConditions().forEach(reaction::setCondition);
    }
    if (document.getReactants() != null) {
      document.getReactants().forEach(c -> reaction.addReactant(
          Molecule.of(requireFormula(c)), c.getCoefficient(), Phase.of(c.getPhase()), c.isCatalyst()));
    }
    if (document.getProducts() != null) {
      document.getProducts().forEach(c -> reaction.addProduct(
          Molecule.of(requireFormula(c)), c.getCoefficient(), Phase.of(c.getPhase())));
    }
    return reaction;
  }

  public String toJson(Reaction reaction) {
    try {
      return OBJECT_MAPPER.writeValueAsString(toDocument(reaction));
    } catch (JsonProcessingException e) {
      throw new ValidationException("Unable to serialize reaction " + reaction, e);
    }
  }

  /**
   * Reads a reaction from JSON.
   *
   * @param json reaction document as JSON
   * @return new reaction
   * @throws ValidationException if the JSON is malformed or describes an invalid reaction
   */
  public Reaction fromJson(String json) {
    ReactionDocument document;
    try {
      document = OBJECT_MAPPER.readValue(json, ReactionDocument.class);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Malformed reaction document", e);
    }
    return fromDocument(document);
  }

  /**
   * Plain map view of a reaction, the same structure the JSON form has.
   *
   * @param reaction reaction
   * @return ordered map of document fields
   */
  public Map<String, Object> toMap(Reaction reaction) {
    return OBJECT_MAPPER.convertValue(toDocument(reaction), MAP_TYPE);
  }

  private static ReactionDocument.ComponentDocument toComponentDocument(ReactionComponent component) {
    Phase phase = component.getPhase();
    return new ReactionDocument.ComponentDocument(
        ChargeNotation.caret(component.getMolecule().getNotation(), component.getMolecule().getCharge()),
        component.getCoefficient(),
        phase.isKnown() ? phase.getSymbol() : null,
        component.isCatalyst());
  }

  private static String requireFormula(ReactionDocument.ComponentDocument component) {
    if (component == null || component.getFormula() == null) {
      throw new ValidationException("Reaction component without formula");
    }
    return component.getFormula();
  }
}
