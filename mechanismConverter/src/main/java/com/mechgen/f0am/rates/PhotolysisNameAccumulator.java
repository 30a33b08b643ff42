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

package com.mechgen.f0am.rates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The distinct photolysis rate names seen during one conversion run, in first-seen order.  One instance belongs to
 * one run; it is handed to every rate translation made in that run.
 */
public class PhotolysisNameAccumulator {
  private final Set<String> names = new LinkedHashSet<>();

  /**
   * @return True if the name had not been registered before.
   */
  public boolean register(String name) {
    return names.add(name);
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  public int size() {
    return names.size();
  }

  public List<String> getNames() {
    return Collections.unmodifiableList(new ArrayList<>(names));
  }
}
