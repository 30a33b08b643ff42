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

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The reactant sides of the reactions in a reference (base) mechanism.  Reactions whose reactant side is in this set
 * are already covered by the base mechanism and are not compiled again.
 */
public class ReferenceReactionSet {
  private final Set<String> reactantSides;

  public ReferenceReactionSet(Set<String> reactantSides) {
    Set<String> normalized = new LinkedHashSet<>(reactantSides.size());
    for (String side : reactantSides) {
      normalized.add(normalize(side));
    }
    this.reactantSides = Collections.unmodifiableSet(normalized);
  }

  public static ReferenceReactionSet empty() {
    return new ReferenceReactionSet(Collections.emptySet());
  }

  public boolean contains(String reactantSide) {
    return reactantSides.contains(normalize(reactantSide));
  }

  public int size() {
    return reactantSides.size();
  }

  public Set<String> getReactantSides() {
    return reactantSides;
  }

  // Spacing around '+' varies between MechGen output and hand-edited base mechanisms.
  private static String normalize(String reactantSide) {
    return StringUtils.normalizeSpace(reactantSide);
  }
}
