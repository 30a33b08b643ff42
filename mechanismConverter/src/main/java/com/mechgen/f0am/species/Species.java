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

package com.mechgen.f0am.species;

import java.util.Objects;

/**
 * A species declaration read from a MechGen species section: the MechGen-internal identifier used in reaction
 * equations, and the common name printed after the comment marker.
 */
public class Species {
  private final String toolId;
  private final String commonName;

  public Species(String toolId, String commonName) {
    this.toolId = toolId;
    this.commonName = commonName;
  }

  public String getToolId() {
    return toolId;
  }

  public String getCommonName() {
    return commonName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Species species = (Species) o;
    return Objects.equals(toolId, species.toolId) && Objects.equals(commonName, species.commonName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(toolId, commonName);
  }

  @Override
  public String toString() {
    return String.format("%s (%s)", toolId, commonName);
  }
}
