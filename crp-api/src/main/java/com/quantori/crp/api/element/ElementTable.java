package com.quantori.crp.api.element;

import com.quantori.crp.api.ValidationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable lookup table of element properties. The default table is read once from the
 * {@code elements.conf} resource; alternate tables can be built from any {@link Config} for tests.
 */
@Slf4j
public final class ElementTable {

  private static final String ROOT_PATH = "elements";

  private final Map<String, ElementProperties> elements;

  private ElementTable(Map<String, ElementProperties> elements) {
    this.elements = Collections.unmodifiableMap(elements);
  }

  public static ElementTable defaultTable() {
    return DefaultHolder.INSTANCE;
  }

  /**
   * Builds a table from a config holding an {@code elements} object keyed by symbol, each entry with
   * {@code atomic-mass} and optional {@code electronegativity} and {@code oxidation-states}.
   *
   * @param config configuration root
   * @return element table
   */
  public static ElementTable fromConfig(Config config) {
    Config root = config.getConfig(ROOT_PATH);
    Map<String, ElementProperties> elements = new LinkedHashMap<>();
    for (String symbol : config.getObject(ROOT_PATH).keySet()) {
      Config entry = root.getConfig(symbol);
      ElementProperties.ElementPropertiesBuilder builder = ElementProperties.builder()
          .symbol(symbol)
          .atomicMass(entry.getDouble("atomic-mass"));
      if (entry.hasPath("electronegativity")) {
        builder.electronegativity(entry.getDouble("electronegativity"));
      }
      if (entry.hasPath("oxidation-states")) {
        builder.oxidationStates(entry.getIntList("oxidation-states"));
      }
      elements.put(symbol, builder.build());
    }
    log.debug("Loaded element table with {} elements", elements.size());
    return new ElementTable(elements);
  }

  public boolean contains(String symbol) {
    return elements.containsKey(symbol);
  }

  public Set<String> symbols() {
    return elements.keySet();
  }

  public Optional<ElementProperties> find(String symbol) {
    return Optional.ofNullable(elements.get(symbol));
  }

  public ElementProperties get(String symbol) {
    return find(symbol).orElseThrow(() -> new ValidationException("Unknown element: " + symbol));
  }

  public double atomicMass(String symbol) {
    return get(symbol).getAtomicMass();
  }

  public OptionalDouble electronegativity(String symbol) {
    return find(symbol).map(ElementProperties::findElectronegativity).orElse(OptionalDouble.empty());
  }

  private static final class DefaultHolder {
    private static final ElementTable INSTANCE = fromConfig(ConfigFactory.load(ROOT_PATH));
  }
}
