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

package com.mechgen.f0am.reactions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A reaction that passed every filter, numbered densely from 1 in the order it was compiled.
 */
public class CompiledReaction {
  public static final String PHOTON = "HV";

  private final int index;
  private final String equation;
  private final String rateExpression;
  private final List<String> reactants;
  private final List<ProductTerm> products;
  private final List<StoichiometryTerm> stoichiometry;
  private final double radicalPoolDelta;

  public CompiledReaction(int index, String equation, String rateExpression, List<String> reactants,
                          List<ProductTerm> products, List<StoichiometryTerm> stoichiometry,
                          double radicalPoolDelta) {
    this.index = index;
    this.equation = equation;
    this.rateExpression = rateExpression;
    this.reactants = Collections.unmodifiableList(new ArrayList<>(reactants));
    this.products = Collections.unmodifiableList(new ArrayList<>(products));
    this.stoichiometry = Collections.unmodifiableList(new ArrayList<>(stoichiometry));
    this.radicalPoolDelta = radicalPoolDelta;
  }

  public int getIndex() {
    return index;
  }

  public String getEquation() {
    return equation;
  }

  public String getRateExpression() {
    return rateExpression;
  }

  // All reactant tokens, the photon included.
  public List<String> getReactants() {
    return reactants;
  }

  public List<String> getDeclaredReactants() {
    List<String> declared = new ArrayList<>(reactants.size());
    for (String reactant : reactants) {
      if (isDeclared(reactant)) {
        declared.add(reactant);
      }
    }
    return declared;
  }

  private static boolean isDeclared(String reactant) {
    return !reactant.isEmpty() && !PHOTON.equals(reactant);
  }

  public List<ProductTerm> getProducts() {
    return products;
  }

  // The balance lines in the order they are written.
  public List<StoichiometryTerm> getStoichiometry() {
    return stoichiometry;
  }

  /**
   * @return The net coefficient of each species over all balance lines, in first-touched order.
   */
  public Map<String, Double> getStoichiometryDeltas() {
    Map<String, Double> deltas = new LinkedHashMap<>();
    for (StoichiometryTerm term : stoichiometry) {
      deltas.merge(term.getSpecies(), term.getCoefficient(), Double::sum);
    }
    return deltas;
  }

  // The summed yield of radical-pool products; only written when positive.
  public double getRadicalPoolDelta() {
    return radicalPoolDelta;
  }

  public String getLabel() {
    return String.format("R%03d", index);
  }

  /**
   * Renders the reaction as an F0AM mechanism block.
   */
  public String toMatlab() {
    StringBuilder declarations = new StringBuilder();
    for (int i = 0; i < reactants.size(); i++) {
      if (isDeclared(reactants.get(i))) {
        declarations.append(String.format("Gstr{i,%d} = '%s'; ", i + 1, reactants.get(i)));
      }
    }

    List<String> lines = new ArrayList<>();
    lines.add(String.format("%%   %d, <%s>", index, getLabel()));
    lines.add("i = i + 1;");
    lines.add(String.format("Rnames{i} = '%s';", equation));
    lines.add(String.format("k(:,i) = %s;", rateExpression));
    lines.add(declarations.toString());
    for (StoichiometryTerm term : stoichiometry) {
      lines.add(term.toMatlab());
    }
    if (stoichiometry.isEmpty()) {
      lines.add("");
    }
    return String.join("\n", lines);
  }

  @Override
  public String toString() {
    return String.format("%s: %s", getLabel(), equation);
  }
}
