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

/**
 * Whether MechGen generated a single-generation mechanism for one precursor or a multi-generation mechanism.  The two
 * label their peroxy radicals differently.
 */
public enum GenerationMode {
  SINGLE("Single"),
  MULTI("Multi"),
  ;

  public static final String MULTI_GENERATION_RADICAL_PREFIX = "RAD";
  public static final String SINGLE_GENERATION_RADICAL_SUFFIX = "r";

  private final String label;

  GenerationMode(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public String radicalPrefix(String precursor) {
    return this == SINGLE ? precursor + SINGLE_GENERATION_RADICAL_SUFFIX : MULTI_GENERATION_RADICAL_PREFIX;
  }

  public static GenerationMode fromLabel(String label) {
    for (GenerationMode mode : values()) {
      if (mode.label.equalsIgnoreCase(label) || mode.name().equalsIgnoreCase(label)) {
        return mode;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown generation mode '%s'", label));
  }
}
