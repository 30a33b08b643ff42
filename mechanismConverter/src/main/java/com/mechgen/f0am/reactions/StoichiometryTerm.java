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

import com.mechgen.f0am.rates.MatlabNumberFormat;

/**
 * One stoichiometric contribution of a reaction to a species, written as an F0AM {@code f<species>(i)} update.
 */
public class StoichiometryTerm {
  private final String species;
  private final double coefficient;

  public StoichiometryTerm(String species, double coefficient) {
    this.species = species;
    this.coefficient = coefficient;
  }

  public String getSpecies() {
    return species;
  }

  public double getCoefficient() {
    return coefficient;
  }

  /**
   * Consumption is always a single molecule and is written as an integer; production keeps its yield as written.
   */
  public String toMatlab() {
    String rhs = coefficient < 0 ?
        String.format("- %d", Math.round(-coefficient)) :
        String.format("+ %s", MatlabNumberFormat.format(coefficient));
    return String.format("f%s(i) = f%s(i) %s;", species, species, rhs);
  }
}
