package com.quantori.crp.core.thermo;

import lombok.Value;

@Value
public class TemperaturePoint {
  double temperature;
  double enthalpy;
  double gibbsEnergy;
  Double equilibriumConstant;
  boolean spontaneous;
}
