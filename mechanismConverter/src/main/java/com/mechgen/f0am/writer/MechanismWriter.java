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

package com.mechgen.f0am.writer;

import com.mechgen.f0am.reactions.CompiledReaction;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes a compiled mechanism as an F0AM mechanism script.  Identifiers are expected to be canonical already; the
 * writer does not rename, filter or reorder anything.
 */
public class MechanismWriter {
  public static final int SPECIES_PER_LINE = 6;

  private final String targetReactant;
  private final String minYield;

  public MechanismWriter(String targetReactant, String minYield) {
    this.targetReactant = targetReactant;
    this.minYield = minYield;
  }

  public void write(Writer out, List<String> compounds, List<CompiledReaction> reactions) throws IOException {
    out.write(String.format("%% MechGen derived %s explicit mechanism\n", targetReactant));
    out.write(String.format("%% Default mechanism with MinYld=%s\n", minYield));

    writeSpecies(out, compounds);
    out.write("\nAddSpecies\n\n");

    out.write("% Reactions:\n");
    for (CompiledReaction reaction : reactions) {
      out.write(reaction.toMatlab());
      out.write("\n\n");
    }
    out.flush();
  }

  void writeSpecies(Writer out, List<String> compounds) throws IOException {
    if (compounds.isEmpty()) {
      out.write("SpeciesToAdd = {};\n");
      return;
    }
    out.write("SpeciesToAdd = {...\n");
    for (int i = 0; i < compounds.size(); i += SPECIES_PER_LINE) {
      List<String> group = compounds.subList(i, Math.min(i + SPECIES_PER_LINE, compounds.size()));
      StringBuilder line = new StringBuilder();
      for (String compound : group) {
        if (line.length() > 0) {
          line.append("; ");
        }
        line.append('\'').append(compound).append('\'');
      }
      out.write(line.toString());
      out.write(i + SPECIES_PER_LINE >= compounds.size() ? ";};\n" : ";...\n");
    }
  }
}
