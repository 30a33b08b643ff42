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

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The ordered master compound list for one conversion run, with the steady-state subset kept alongside it.
 */
public class CompoundCatalog {
  private final List<String> allCompounds;
  private final List<String> steadyStateCompounds;
  private final Set<String> members;

  public CompoundCatalog(List<String> allCompounds, List<String> steadyStateCompounds) {
    this.allCompounds = Collections.unmodifiableList(allCompounds);
    this.steadyStateCompounds = Collections.unmodifiableList(steadyStateCompounds);
    this.members = Collections.unmodifiableSet(new HashSet<>(allCompounds));
  }

  public List<String> getAllCompounds() {
    return allCompounds;
  }

  public List<String> getSteadyStateCompounds() {
    return steadyStateCompounds;
  }

  public boolean contains(String compound) {
    return members.contains(compound);
  }

  public int size() {
    return allCompounds.size();
  }
}
