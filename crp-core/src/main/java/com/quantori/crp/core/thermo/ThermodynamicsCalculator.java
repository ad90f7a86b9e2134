package com.quantori.crp.core.thermo;

import com.quantori.crp.api.Phase;
import com.quantori.crp.api.ValidationException;
import com.quantori.crp.core.model.Reaction;
import com.quantori.crp.core.model.ReactionComponent;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Reaction enthalpy, entropy and Gibbs energy from standard formation data, with the derived
 * equilibrium constant, temperature dependence and feasibility.
 * <p>
 * All state functions require a balanced reaction and skip catalysts. Species missing from the
 * {@link ThermodynamicTable} are reported on the result instead of failing the calculation.
 * Enthalpy away from the standard temperature is corrected with a constant ΔCp; Gibbs energy at the
 * standard temperature comes from the formation Gibbs energies and elsewhere from {@code ΔH - TΔS}.
 */
@Slf4j
public class ThermodynamicsCalculator {

  private static final double KILO = 1000.0;
  private static final double TEMPERATURE_EPSILON = 1e-9;

  private final ThermodynamicTable table;

  public ThermodynamicsCalculator(ThermodynamicTable table) {
    this.table = table;
  }

  /**
   * Enthalpy at the reaction's temperature, or the standard temperature when none is set.
   *
   * @param reaction balanced reaction
   * @return enthalpy change
   */
  public EnthalpyChange enthalpy(Reaction reaction) {
    return enthalpy(reaction, temperatureOf(reaction));
  }

  public EnthalpyChange enthalpy(Reaction reaction, double temperature) {
    requireBalanced(reaction);
    requirePositive(temperature);
    Sum formation = sum(reaction, FormationData::getEnthalpy);
    double value = formation.getValue();
    if (!isStandard(temperature) && formation.isComplete()) {
      double heatCapacityChange = sum(reaction, FormationData::getHeatCapacity).getValue();
      value += heatCapacityChange * (temperature - table.getStandardTemperature()) / KILO;
    }
    return new EnthalpyChange(value, temperature, formation.getMissing());
  }

  public EntropyChange entropy(Reaction reaction) {
    return entropy(reaction, temperatureOf(reaction));
  }

  public EntropyChange entropy(Reaction reaction, double temperature) {
    requireBalanced(reaction);
    requirePositive(temperature);
    Sum standardEntropy = sum(reaction, FormationData::getEntropy);
    return new EntropyChange(standardEntropy.getValue(), temperature, standardEntropy.getMissing());
  }

  public GibbsEnergyChange gibbsEnergy(Reaction reaction) {
    return gibbsEnergy(reaction, temperatureOf(reaction));
  }

  /**
   * Gibbs energy and equilibrium constant {@code K = exp(-ΔG / RT)}.
   *
   * @param reaction    balanced reaction
   * @param temperature temperature in K
   * @return Gibbs energy change; the constant is null when data is missing
   * @throws ValidationException if the reaction is not balanced or the temperature is not positive
   */
  public GibbsEnergyChange gibbsEnergy(Reaction reaction, double temperature) {
    requireBalanced(reaction);
    requirePositive(temperature);
    double value;
    List<String> missing;
    if (isStandard(temperature)) {
      Sum formation = sum(reaction, FormationData::getGibbsEnergy);
      value = formation.getValue();
      missing = formation.getMissing();
    } else {
      EnthalpyChange enthalpy = enthalpy(reaction, temperature);
      EntropyChange entropy = entropy(reaction, temperature);
      value = enthalpy.getValue() - temperature * entropy.getValue() / KILO;
      missing = enthalpy.getMissingSpecies();
    }
    Double constant = missing.isEmpty()
        ? Math.exp(-value * KILO / (table.getGasConstant() * temperature))
        : null;
    if (!missing.isEmpty()) {
      log.debug("No formation data for {} in {}", missing, reaction);
    }
    return new GibbsEnergyChange(value, temperature, constant, missing);
  }

  public FeasibilityAnalysis feasibility(Reaction reaction) {
    return feasibility(reaction, temperatureOf(reaction));
  }

  /**
   * Combines enthalpy, entropy and Gibbs energy into a feasibility verdict with recommendations.
   *
   * @param reaction    balanced reaction
   * @param temperature temperature in K
   * @return feasibility analysis, {@link TemperatureRegime#UNDETERMINED} when data is missing
   */
  public FeasibilityAnalysis feasibility(Reaction reaction, double temperature) {
    EnthalpyChange enthalpy = enthalpy(reaction, temperature);
    EntropyChange entropy = entropy(reaction, temperature);
    GibbsEnergyChange gibbs = gibbsEnergy(reaction, temperature);
    boolean complete = enthalpy.isComplete() && gibbs.isComplete();

    FeasibilityAnalysis.FeasibilityAnalysisBuilder analysis = FeasibilityAnalysis.builder()
        .temperature(temperature)
        .complete(complete)
        .enthalpy(enthalpy)
        .entropy(entropy)
        .gibbsEnergy(gibbs);
    if (!complete) {
      return analysis
          .feasible(false)
          .regime(TemperatureRegime.UNDETERMINED)
          .recommendation(TemperatureRegime.UNDETERMINED.getRecommendation())
          .build();
    }

    // entropies are tabulated at the standard temperature only
    double standardEnthalpy = enthalpy(reaction, table.getStandardTemperature()).getValue();
    TemperatureRegime regime = TemperatureRegime.of(standardEnthalpy, entropy.getValue());
    analysis.feasible(gibbs.isSpontaneous())
        .regime(regime)
        .crossoverTemperature(regime.hasCrossover() ? standardEnthalpy * KILO / entropy.getValue() : null);
    if (regime != TemperatureRegime.UNDETERMINED) {
      analysis.recommendation(regime.getRecommendation());
    }
    if (gibbs.isSpontaneous()) {
      analysis.recommendation("Focus on optimizing kinetics and reaction conditions");
    } else {
      analysis.recommendation("Consider changing reaction conditions")
          .recommendation("Look for alternative reaction pathways")
          .recommendation("Consider using a catalyst to lower activation energy");
    }
    return analysis.build();
  }

  /**
   * Enthalpy, Gibbs energy and equilibrium constant at evenly spaced temperatures.
   *
   * @param reaction       balanced reaction
   * @param minTemperature first temperature in K
   * @param maxTemperature last temperature in K
   * @param points         number of temperatures, at least 2
   * @return one point per temperature, ascending
   */
  public List<TemperaturePoint> temperatureDependence(Reaction reaction, double minTemperature,
                                                      double maxTemperature, int points) {
    if (points < 2) {
      throw new ValidationException("At least two temperature points are required, got " + points);
    }
    requirePositive(minTemperature);
    if (maxTemperature < minTemperature) {
      throw new ValidationException("Temperature range is empty: " + minTemperature + " > " + maxTemperature);
    }
    List<TemperaturePoint> profile = new ArrayList<>(points);
    for (int i = 0; i < points; i++) {
      double temperature = minTemperature + i * (maxTemperature - minTemperature) / (points - 1);
      GibbsEnergyChange gibbs = gibbsEnergy(reaction, temperature);
      profile.add(new TemperaturePoint(temperature, enthalpy(reaction, temperature).getValue(), gibbs.getValue(),
          gibbs.getEquilibriumConstant(), gibbs.isSpontaneous()));
    }
    return profile;
  }

  /**
   * Fits the Arrhenius equation to rate constants measured at several temperatures.
   *
   * @param rateConstants temperature in K to rate constant; non-positive values are skipped
   * @return fitted activation energy and pre-exponential factor
   * @throws ValidationException if fewer than two usable points at distinct temperatures remain
   */
  public ArrheniusFit activationEnergy(Map<Double, Double> rateConstants) {
    TreeMap<Double, Double> usable = new TreeMap<>();
    rateConstants.forEach((temperature, rate) -> {
      if (temperature != null && rate != null && temperature > 0 && rate > 0) {
        usable.put(temperature, rate);
      }
    });
    if (usable.size() < 2) {
      throw new ValidationException("At least two positive rate constants at distinct temperatures are required");
    }

    int n = usable.size();
    DMatrixRMaj design = new DMatrixRMaj(n, 2);
    DMatrixRMaj logRates = new DMatrixRMaj(n, 1);
    int row = 0;
    for (Map.Entry<Double, Double> point : usable.entrySet()) {
      design.set(row, 0, 1.0);
      design.set(row, 1, 1.0 / point.getKey());
      logRates.set(row, 0, Math.log(point.getValue()));
      row++;
    }
    DMatrixRMaj fit = new DMatrixRMaj(2, 1);
    if (!CommonOps_DDRM.solve(design, logRates, fit)) {
      throw new ValidationException("Rate constants do not determine an Arrhenius fit");
    }
    double intercept = fit.get(0, 0);
    double slope = fit.get(1, 0);

    double mean = CommonOps_DDRM.elementSum(logRates) / n;
    double totalSquares = 0.0;
    double residualSquares = 0.0;
    for (int i = 0; i < n; i++) {
      double observed = logRates.get(i, 0);
      double predicted = intercept + slope * design.get(i, 1);
      totalSquares += (observed - mean) * (observed - mean);
      residualSquares += (observed - predicted) * (observed - predicted);
    }

    return ArrheniusFit.builder()
        .activationEnergy(-slope * table.getGasConstant() / KILO)
        .preExponentialFactor(Math.exp(intercept))
        .rSquared(totalSquares == 0.0 ? 0.0 : 1.0 - residualSquares / totalSquares)
        .minTemperature(usable.firstKey())
        .maxTemperature(usable.lastKey())
        .dataPoints(n)
        .build();
  }

  /**
   * Le Chatelier shift on raising the pressure, from the moles of gas on each side.
   *
   * @param reaction reaction with gas phases set
   * @return shift toward the side with fewer moles of gas, {@link EquilibriumShift#NONE} when equal
   */
  public EquilibriumShift pressureIncreaseShift(Reaction reaction) {
    double reactantGas = gasMoles(reaction.getReactants(false));
    double productGas = gasMoles(reaction.getProducts());
    if (productGas < reactantGas) {
      return EquilibriumShift.TOWARD_PRODUCTS;
    }
    if (productGas > reactantGas) {
      return EquilibriumShift.TOWARD_REACTANTS;
    }
    return EquilibriumShift.NONE;
  }

  /**
   * Le Chatelier shift on raising the temperature: toward products for endothermic reactions.
   *
   * @param reaction balanced reaction
   * @return shift, {@link EquilibriumShift#UNDETERMINED} when formation data is missing
   */
  public EquilibriumShift temperatureIncreaseShift(Reaction reaction) {
    EnthalpyChange enthalpy = enthalpy(reaction, table.getStandardTemperature());
    if (!enthalpy.isComplete()) {
      return EquilibriumShift.UNDETERMINED;
    }
    if (enthalpy.isEndothermic()) {
      return EquilibriumShift.TOWARD_PRODUCTS;
    }
    return enthalpy.isExothermic() ? EquilibriumShift.TOWARD_REACTANTS : EquilibriumShift.NONE;
  }

  private double temperatureOf(Reaction reaction) {
    return reaction.getTemperature() != null ? reaction.getTemperature() : table.getStandardTemperature();
  }

  private boolean isStandard(double temperature) {
    return Math.abs(temperature - table.getStandardTemperature()) < TEMPERATURE_EPSILON;
  }

  private Sum sum(Reaction reaction, ToDoubleFunction<FormationData> property) {
    double value = 0.0;
    Set<String> missing = new LinkedHashSet<>();
    for (ReactionComponent product : reaction.getProducts()) {
      Optional<FormationData> data = table.find(product.getFormula());
      if (data.isPresent()) {
        value += product.getCoefficient() * property.applyAsDouble(data.get());
      } else {
        missing.add(product.getFormula());
      }
    }
    for (ReactionComponent reactant : reaction.getReactants(false)) {
      Optional<FormationData> data = table.find(reactant.getFormula());
      if (data.isPresent()) {
        value -= reactant.getCoefficient() * property.applyAsDouble(data.get());
      } else {
        missing.add(reactant.getFormula());
      }
    }
    return new Sum(value, List.copyOf(missing));
  }

  private static double gasMoles(List<ReactionComponent> components) {
    return components.stream()
        .filter(c -> c.getPhase() == Phase.GAS)
        .mapToDouble(ReactionComponent::getCoefficient)
        .sum();
  }

  private static void requireBalanced(Reaction reaction) {
    if (!reaction.isBalanced()) {
      throw new ValidationException("Reaction must be balanced for thermodynamic calculations: " + reaction);
    }
  }

  private static void requirePositive(double temperature) {
    if (!(temperature > 0) || Double.isInfinite(temperature)) {
      throw new ValidationException("Temperature must be positive, got " + temperature);
    }
  }

  @Value
  private static class Sum {
    double value;
    List<String> missing;

    boolean isComplete() {
      return missing.isEmpty();
    }
  }
}
