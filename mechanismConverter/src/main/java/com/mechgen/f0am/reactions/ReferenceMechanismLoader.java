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

import com.mechgen.f0am.naming.NamingRules;
import com.mechgen.f0am.utils.FileChecker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the reactant sides of an existing F0AM mechanism file from its {@code Rnames{<i>} = '<equation>';} lines.
 */
public class ReferenceMechanismLoader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReferenceMechanismLoader.class);

  private static final String RNAMES_PREFIX = "Rnames{";
  private static final String EQUATION_START = "= '";
  private static final String EQUATION_END = "';";
  private static final String EQUATION_SEPARATOR = "=";

  private final NamingRules namingRules;

  public ReferenceMechanismLoader(NamingRules namingRules) {
    this.namingRules = namingRules;
  }

  public ReferenceReactionSet load(File referenceFile) throws IOException {
    FileChecker.verifyInputFile(referenceFile);
    try (BufferedReader reader = Files.newBufferedReader(referenceFile.toPath(), StandardCharsets.UTF_8)) {
      Set<String> reactantSides = new LinkedHashSet<>();
      String line;
      while ((line = reader.readLine()) != null) {
        String side = extractReactantSide(line);
        if (side != null) {
          reactantSides.add(side);
        }
      }
      LOGGER.info("Read %d reference reactant sets from %s", reactantSides.size(), referenceFile.getName());
      return new ReferenceReactionSet(reactantSides);
    }
  }

  public ReferenceReactionSet load(List<String> lines) {
    Set<String> reactantSides = new LinkedHashSet<>();
    for (String line : lines) {
      String side = extractReactantSide(line);
      if (side != null) {
        reactantSides.add(side);
      }
    }
    return new ReferenceReactionSet(reactantSides);
  }

  String extractReactantSide(String line) {
    if (!line.startsWith(RNAMES_PREFIX)) {
      return null;
    }
    int start = line.indexOf(EQUATION_START);
    if (start < 0) {
      return null;
    }
    start += EQUATION_START.length();
    int end = line.indexOf(EQUATION_END, start);
    if (end < 0) {
      LOGGER.debug("Unterminated reference equation: %s", line);
      return null;
    }
    String equation = NamingRules.normalizeHyphens(line.substring(start, end));
    int separator = equation.indexOf(EQUATION_SEPARATOR);
    String reactants = separator < 0 ? equation : equation.substring(0, separator);
    return namingRules.canonicalizeEquation(reactants.trim());
  }
}
