package com.quantori.crp.core.thermo;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable standard formation data keyed by Hill formula. The default table is read once from the
 * {@code thermodynamics.conf} resource.
 */
@Slf4j
public final class ThermodynamicTable {

  private static final String ROOT_PATH = "thermodynamics";

  @Getter
  private final double standardTemperature;
  @Getter
  private final double gasConstant;
  private final Map<String, FormationData> species;

  private ThermodynamicTable(double standardTemperature, double gasConstant, Map<String, FormationData> species) {
    this.standardTemperature = standardTemperature;
    this.gasConstant = gasConstant;
    this.species = Collections.unmodifiableMap(species);
  }

  public static ThermodynamicTable defaultTable() {
    return DefaultHolder.INSTANCE;
  }

  /**
   * Builds a table from the {@code thermodynamics} section of a config.
   *
   * @param config configuration root
   * @return thermodynamic table
   */
  public static ThermodynamicTable fromConfig(Config config) {
    Config root = config.getConfig(ROOT_PATH);
    Config speciesConfig = root.getConfig("species");
    Map<String, FormationData> species = new LinkedHashMap<>();
    for (String formula : root.getObject("species").keySet()) {
      Config entry = speciesConfig.getConfig(formula);
      species.put(formula, FormationData.builder()
          .formula(formula)
          .enthalpy(entry.getDouble("enthalpy"))
          .gibbsEnergy(entry.getDouble("gibbs-energy"))
          .entropy(entry.getDouble("entropy"))
          .heatCapacity(entry.getDouble("heat-capacity"))
          .build());
    }
    log.debug("Loaded formation data for {} species", species.size());
    return new ThermodynamicTable(root.getDouble("standard-temperature"), root.getDouble("gas-constant"), species);
  }

  public Optional<FormationData> find(String hillFormula) {
    return Optional.ofNullable(species.get(hillFormula));
  }

  public Set<String> formulas() {
    return species.keySet();
  }

  private static final class DefaultHolder {
    private static final ThermodynamicTable INSTANCE = fromConfig(ConfigFactory.load(ROOT_PATH));
  }
}
