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

package com.mechgen.f0am.naming;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps MechGen identifiers onto names that are legal MATLAB variables in F0AM.
 *
 * Every identifier passes through {@link #canonicalize(String)} once, at the point it is read from an input file,
 * so serialized text never needs a second substitution pass.  Replacement is whole-identifier only: a table key
 * that appears inside a longer identifier leaves that identifier alone.
 */
public class NamingRules {
  public static final String RADICAL_POOL_SPECIES = "RO2";

  // MATLAB variables may not start with a digit, and RO2/RCO3 collide with F0AM's lumped counter names.
  public static final Map<String, String> DEFAULT_REPLACEMENTS = Collections.unmodifiableMap(
      new LinkedHashMap<String, String>() {{
        put("RO2", "SumRO2");
        put("RCO3", "SumRCO3");
        put("2M2C5E4O", "TM2C5E4O");
        put("4OX2PEAL", "FOX2PEAL");
        put("3M_FURAN", "M3FURAN");
        put("2MBUTDAL", "M2BUTDAL");
      }});

  private static final Pattern TOKEN_PATTERN = Pattern.compile("[^\\s+=]+");

  private final Map<String, String> replacements;

  public NamingRules() {
    this(DEFAULT_REPLACEMENTS);
  }

  public NamingRules(Map<String, String> replacements) {
    Map<String, String> normalized = new LinkedHashMap<>(replacements.size());
    for (Map.Entry<String, String> entry : replacements.entrySet()) {
      String target = normalizeHyphens(entry.getValue());
      if (replacements.containsKey(target) && !target.equals(entry.getKey())) {
        // A chained rule would make canonicalization depend on how many times it is applied.
        throw new IllegalArgumentException(String.format(
            "Replacement target %s for %s is itself a replaced identifier", target, entry.getKey()));
      }
      normalized.put(normalizeHyphens(entry.getKey()), target);
    }
    this.replacements = Collections.unmodifiableMap(normalized);
  }

  public static String normalizeHyphens(String identifier) {
    return StringUtils.replace(identifier, "-", "_");
  }

  public String canonicalize(String identifier) {
    String normalized = normalizeHyphens(identifier);
    String replacement = replacements.get(normalized);
    return replacement == null ? normalized : replacement;
  }

  public List<String> canonicalizeAll(List<String> identifiers) {
    return identifiers.stream().map(this::canonicalize).collect(Collectors.toList());
  }

  /**
   * Canonicalizes each species token of an equation, leaving '+', '=', yields and spacing as-is.
   */
  public String canonicalizeEquation(String equation) {
    Matcher matcher = TOKEN_PATTERN.matcher(normalizeHyphens(equation));
    StringBuffer sb = new StringBuffer();
    while (matcher.find()) {
      matcher.appendReplacement(sb, Matcher.quoteReplacement(canonicalize(matcher.group())));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  public String getRadicalPoolSpecies() {
    return canonicalize(RADICAL_POOL_SPECIES);
  }

  public Map<String, String> getReplacements() {
    return replacements;
  }
}
