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

import com.mechgen.f0am.MechanismFormatException;
import com.mechgen.f0am.naming.NamingRules;
import com.mechgen.f0am.utils.SectionScanner;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the compound list for a conversion run from the species sections of a MechGen reaction file.
 *
 * MechGen lists the active species between .ACT and .RXN and the steady-state species between .STS and .RXN.  Each
 * data line looks like {@code <mechgen id> ... ! ... <common name>}; lines whose first token starts with '!' are
 * comments and lines whose first token starts with '.' are continuations or markers.
 */
public class SpeciesCatalogBuilder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpeciesCatalogBuilder.class);

  public static final String STEADY_STATE_START = ".STS";
  public static final String ACTIVE_START = ".ACT";
  public static final String SECTION_END = ".RXN";

  private static final String COMMENT_PREFIX = "!";
  private static final String CONTINUATION_PREFIX = ".";
  private static final char NAME_DELIMITER = '!';

  private static final Pattern WORD_PATTERN = Pattern.compile("\\w+");
  private static final Pattern PLAIN_WORD = Pattern.compile("^\\w+$");

  private final NamingRules namingRules;

  public SpeciesCatalogBuilder(NamingRules namingRules) {
    this.namingRules = namingRules;
  }

  /**
   * Extracts the species declared between two marker lines, deduplicated by common name (first occurrence wins).
   * @param lines The lines of the reaction file.
   * @param startMarker The line opening the section; must be present.
   * @param endMarker The line closing the section; if missing the section runs to end of file.
   * @return The declared species in file order.
   * @throws MechanismFormatException If the start marker is missing.
   */
  public List<Species> extractSection(List<String> lines, String startMarker, String endMarker)
      throws MechanismFormatException {
    List<String> section = new SectionScanner(startMarker, endMarker, false).scan(lines);

    Map<String, Species> byCommonName = new LinkedHashMap<>();
    int skipped = 0;
    for (String line : section) {
      Species species = parseSpeciesLine(line);
      if (species == null) {
        skipped++;
        continue;
      }
      byCommonName.putIfAbsent(species.getCommonName(), species);
    }
    LOGGER.debug("Section %s: %d species, %d non-data lines", startMarker, byCommonName.size(), skipped);
    return new ArrayList<>(byCommonName.values());
  }

  Species parseSpeciesLine(String line) {
    String[] tokens = StringUtils.split(line);
    if (tokens == null || tokens.length == 0) {
      return null;
    }
    if (tokens[0].startsWith(COMMENT_PREFIX) || tokens[0].startsWith(CONTINUATION_PREFIX)) {
      return null;
    }

    int delimiter = line.indexOf(NAME_DELIMITER);
    if (delimiter < 0) {
      return null;
    }
    String[] idTokens = StringUtils.split(line.substring(0, delimiter));
    if (idTokens.length == 0) {
      return null;
    }

    // The common name is the last word of the first comment field; later '!' fields are ignored.
    int nextDelimiter = line.indexOf(NAME_DELIMITER, delimiter + 1);
    String nameField = nextDelimiter < 0 ?
        line.substring(delimiter + 1) : line.substring(delimiter + 1, nextDelimiter);
    String[] nameTokens = StringUtils.split(nameField);
    if (nameTokens.length == 0) {
      return null;
    }

    return new Species(namingRules.canonicalize(idTokens[0]),
        NamingRules.normalizeHyphens(nameTokens[nameTokens.length - 1]));
  }

  /**
   * Assembles the master compound list: defaults, then active species not already listed, then steady-state species.
   * @param lines The lines of the reaction file.
   * @param defaults Compounds every F0AM mechanism declares (counters, mass bookkeeping, ...).
   * @return The catalog of all compounds and the steady-state subset.
   * @throws MechanismFormatException If either species section is missing.
   */
  public CompoundCatalog buildCompounds(List<String> lines, List<String> defaults) throws MechanismFormatException {
    List<String> steadyState = toolIds(extractSection(lines, STEADY_STATE_START, SECTION_END));
    List<String> active = toolIds(extractSection(lines, ACTIVE_START, SECTION_END));
    List<String> canonicalDefaults = namingRules.canonicalizeAll(defaults);

    Set<String> excluded = new HashSet<>(canonicalDefaults);
    excluded.addAll(steadyState);

    List<String> all = new ArrayList<>(canonicalDefaults);
    for (String compound : active) {
      if (!excluded.contains(compound)) {
        all.add(compound);
      }
    }
    all.addAll(steadyState);

    LOGGER.info("Built compound list: %d defaults, %d active, %d steady-state",
        canonicalDefaults.size(), all.size() - canonicalDefaults.size() - steadyState.size(), steadyState.size());
    return new CompoundCatalog(all, steadyState);
  }

  private List<String> toolIds(List<Species> species) {
    List<String> ids = new ArrayList<>(species.size());
    for (Species s : species) {
      ids.add(s.getToolId());
    }
    return ids;
  }

  /**
   * Splits a compound list into the compounds that occur as whole words in the compiled reactions and those that
   * do not.  Order is preserved within each half.
   * @param compounds The compound list to filter.
   * @param reactionTexts The formatted reaction blocks.
   * @return A pair of (retained, dropped) compounds.
   */
  public static Pair<List<String>, List<String>> cleanNullCompounds(List<String> compounds,
                                                                  List<String> reactionTexts) {
    String combined = StringUtils.join(reactionTexts, " ");

    Set<String> words = new HashSet<>();
    Matcher matcher = WORD_PATTERN.matcher(combined);
    while (matcher.find()) {
      words.add(matcher.group());
    }

    List<String> retained = new ArrayList<>();
    List<String> dropped = new ArrayList<>();
    for (String compound : compounds) {
      if (occursAsWord(compound, words, combined)) {
        retained.add(compound);
      } else {
        dropped.add(compound);
      }
    }
    return Pair.of(retained, dropped);
  }

  private static boolean occursAsWord(String compound, Set<String> words, String text) {
    if (compound.isEmpty()) {
      return false;
    }
    if (PLAIN_WORD.matcher(compound).matches()) {
      return words.contains(compound);
    }
    // Identifiers with non-word characters are rare enough to search for directly.
    Pattern p = Pattern.compile("(?<!\\w)" + Pattern.quote(compound) + "(?!\\w)");
    return p.matcher(text).find();
  }
}
