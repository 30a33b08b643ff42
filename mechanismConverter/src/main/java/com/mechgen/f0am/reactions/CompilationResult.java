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

import com.mechgen.f0am.ConversionReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CompilationResult {
  private final List<CompiledReaction> reactions;
  private final List<String> photolysisNames;
  private final ConversionReport report;

  public CompilationResult(List<CompiledReaction> reactions, List<String> photolysisNames, ConversionReport report) {
    this.reactions = Collections.unmodifiableList(reactions);
    this.photolysisNames = photolysisNames;
    this.report = report;
  }

  public List<CompiledReaction> getReactions() {
    return reactions;
  }

  public List<String> getReactionTexts() {
    List<String> texts = new ArrayList<>(reactions.size());
    for (CompiledReaction reaction : reactions) {
      texts.add(reaction.toMatlab());
    }
    return texts;
  }

  public List<String> getPhotolysisNames() {
    return photolysisNames;
  }

  public ConversionReport getReport() {
    return report;
  }
}
