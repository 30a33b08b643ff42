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

/**
 * Why a raw reaction record was left out of the compiled mechanism.  None of these stop a conversion run.
 */
public enum SkipReason {
  // The record has no ';' between its rate and equation, or its equation has no single '='.
  MALFORMED_RECORD("malformed record"),
  // The first reactant is not in the compound list.
  UNDEFINED_SPECIES("undefined reactant"),
  // The reactants already appear in the reference mechanism.
  DUPLICATE_SUPPRESSED("already in reference mechanism"),
  // The reactant is a radical whose generation number is above the configured cutoff.
  RADICAL_CUTOFF("beyond radical generation cutoff"),
  ;

  private final String description;

  SkipReason(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
