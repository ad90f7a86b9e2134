package com.quantori.crp.core.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Plain serializable form of a reaction.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReactionDocument {

  @JsonProperty("name")
  private String name;

  @JsonProperty("reactants")
  private List<ComponentDocument> reactants = new ArrayList<>();

  @JsonProperty("products")
  private List<ComponentDocument> products = new ArrayList<>();

  @JsonProperty("temperature")
  private Double temperature;

  @JsonProperty("pressure")
  private Double pressure;

  @JsonProperty("conditions")
  private Map<String, String> conditions = new LinkedHashMap<>();

  /**
   * Informational; recomputed from the components when a document is read.
   */
  @JsonProperty("balanced")
  private boolean balanced;

  /**
   * One reactant, product or catalyst. The formula uses caret charge notation ({@code Fe^2+}).
   */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ComponentDocument {

    @JsonProperty("formula")
    private String formula;

    @JsonProperty("coefficient")
    private double coefficient = 1.0;

    @JsonProperty("phase")
    private String phase;

    @JsonProperty("is_catalyst")
    private boolean catalyst;
  }
}
