/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.mechgen.f0am;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mechgen.f0am.naming.NamingRules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
  public static final List<String> DEFAULT_COMPOUNDS = Collections.unmodifiableList(Arrays.asList(
      "RO2", "RCO3", // Counter species
      "LostMoles", "LostMass",
      "NegC", "NegH", "NegN", "NegO",
      "GLYOXAL", "FORMACID"
  ));
  public static final String DEFAULT_GENERATION = "Multi";
  public static final String DEFAULT_MIN_YIELD = "0.001";

  // The precursor MechGen generated the mechanism for, e.g. ISOPRENE.
  @JsonProperty(value = "target_reactant", required = true)
  String targetReactant;

  // "Single" or "Multi"; decides how radical-pool species are recognized.
  @JsonProperty("generation")
  String generation = DEFAULT_GENERATION;

  // The MinYld option MechGen ran with.  Only echoed in the output header.
  @JsonProperty("min_yield")
  String minYield = DEFAULT_MIN_YIELD;

  // The MechGen reaction file.  Defaults to MG-<target>_Rxnfile_<min yield>.dat.
  @JsonProperty("input_file")
  String inputFile;

  // An F0AM base mechanism whose reactions should not be repeated.  Optional.
  @JsonProperty("reference_file")
  String referenceFile;

  // Defaults to MechGen_<target>.m.
  @JsonProperty("output_file")
  String outputFile;

  // Radicals of later generations than this are dropped.  Null or 0 keeps all of them.
  @JsonProperty("radical_cutoff")
  Integer radicalCutoff;

  // Whether VBS (SOA proxy) products get balance lines.
  @JsonProperty("include_aggregate_products")
  Boolean includeAggregateProducts = false;

  @JsonProperty("default_compounds")
  List<String> defaultCompounds = new ArrayList<>(DEFAULT_COMPOUNDS);

  // Identifiers that are not valid MATLAB names, and what to call them instead.
  @JsonProperty("name_replacements")
  Map<String, String> nameReplacements = new LinkedHashMap<>(NamingRules.DEFAULT_REPLACEMENTS);

  public ConverterConfig() {
  }

  public ConverterConfig(String targetReactant) {
    this.targetReactant = targetReactant;
  }

  public String getTargetReactant() {
    return targetReactant;
  }

  public void setTargetReactant(String targetReactant) {
    this.targetReactant = targetReactant;
  }

  public String getGeneration() {
    return generation;
  }

  public void setGeneration(String generation) {
    this.generation = generation;
  }

  public String getMinYield() {
    return minYield;
  }

  public void setMinYield(String minYield) {
    this.minYield = minYield;
  }

  public String getInputFile() {
    return inputFile != null ? inputFile : String.format("MG-%s_Rxnfile_%s.dat", targetReactant, minYield);
  }

  public void setInputFile(String inputFile) {
    this.inputFile = inputFile;
  }

  public String getReferenceFile() {
    return referenceFile;
  }

  public void setReferenceFile(String referenceFile) {
    this.referenceFile = referenceFile;
  }

  public String getOutputFile() {
    return outputFile != null ? outputFile : String.format("MechGen_%s.m", targetReactant);
  }

  public void setOutputFile(String outputFile) {
    this.outputFile = outputFile;
  }

  public Integer getRadicalCutoff() {
    return radicalCutoff;
  }

  public void setRadicalCutoff(Integer radicalCutoff) {
    this.radicalCutoff = radicalCutoff;
  }

  public boolean getIncludeAggregateProducts() {
    return includeAggregateProducts != null && includeAggregateProducts;
  }

  public void setIncludeAggregateProducts(Boolean includeAggregateProducts) {
    this.includeAggregateProducts = includeAggregateProducts;
  }

  public List<String> getDefaultCompounds() {
    return defaultCompounds != null ? defaultCompounds : DEFAULT_COMPOUNDS;
  }

  public void setDefaultCompounds(List<String> defaultCompounds) {
    this.defaultCompounds = defaultCompounds;
  }

  public Map<String, String> getNameReplacements() {
    return nameReplacements != null ? nameReplacements : NamingRules.DEFAULT_REPLACEMENTS;
  }

  public void setNameReplacements(Map<String, String> nameReplacements) {
    this.nameReplacements = nameReplacements;
  }
}
