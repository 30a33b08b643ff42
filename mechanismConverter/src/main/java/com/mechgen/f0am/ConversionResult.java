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

import com.mechgen.f0am.reactions.CompilationResult;
import com.mechgen.f0am.reactions.CompiledReaction;

import java.util.Collections;
import java.util.List;

public class ConversionResult {
  private final List<String> compounds;
  private final List<String> droppedCompounds;
  private final CompilationResult compilation;

  public ConversionResult(List<String> compounds, List<String> droppedCompounds, CompilationResult compilation) {
    this.compounds = Collections.unmodifiableList(compounds);
    this.droppedCompounds = Collections.unmodifiableList(droppedCompounds);
    this.compilation = compilation;
  }

  // The compounds written to the mechanism: those used by at least one reaction.
  public List<String> getCompounds() {
    return compounds;
  }

  public List<String> getDroppedCompounds() {
    return droppedCompounds;
  }

  public List<CompiledReaction> getReactions() {
    return compilation.getReactions();
  }

  public List<String> getPhotolysisNames() {
    return compilation.getPhotolysisNames();
  }

  public ConversionReport getReport() {
    return compilation.getReport();
  }
}
