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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tallies of everything a conversion run skipped, passed through or dropped without failing.
 */
public class ConversionReport {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConversionReport.class);

  private final Map<SkipReason, Integer> skipCounts = new EnumMap<>(SkipReason.class);
  private int rawRecords = 0;
  private int compiledReactions = 0;
  private int nonNumericRates = 0;
  private final Set<String> undeclaredProducts = new LinkedHashSet<>();
  private final List<String> droppedCompounds = new ArrayList<>();

  public ConversionReport() {
    for (SkipReason reason : SkipReason.values()) {
      skipCounts.put(reason, 0);
    }
  }

  public void recordRawRecord() {
    rawRecords++;
  }

  public void recordSkip(SkipReason reason) {
    skipCounts.put(reason, skipCounts.get(reason) + 1);
  }

  public void recordCompiled() {
    compiledReactions++;
  }

  public void recordNonNumericRate() {
    nonNumericRates++;
  }

  public void recordUndeclaredProduct(String species) {
    undeclaredProducts.add(species);
  }

  public void recordDroppedCompounds(List<String> compounds) {
    droppedCompounds.addAll(compounds);
  }

  public int getSkipCount(SkipReason reason) {
    return skipCounts.get(reason);
  }

  public int getTotalSkipped() {
    int total = 0;
    for (Integer count : skipCounts.values()) {
      total += count;
    }
    return total;
  }

  public int getRawRecords() {
    return rawRecords;
  }

  public int getCompiledReactions() {
    return compiledReactions;
  }

  public int getNonNumericRates() {
    return nonNumericRates;
  }

  public Set<String> getUndeclaredProducts() {
    return Collections.unmodifiableSet(undeclaredProducts);
  }

  public List<String> getDroppedCompounds() {
    return Collections.unmodifiableList(droppedCompounds);
  }

  public void logSummary() {
    LOGGER.info("Compiled %d of %d raw reactions", compiledReactions, rawRecords);
    for (Map.Entry<SkipReason, Integer> entry : skipCounts.entrySet()) {
      if (entry.getValue() > 0) {
        LOGGER.info("...Skipped %d reactions: %s", entry.getValue(), entry.getKey().getDescription());
      }
    }
    if (nonNumericRates > 0) {
      LOGGER.warn("%d rates were not in a known form and were copied verbatim", nonNumericRates);
    }
    if (!undeclaredProducts.isEmpty()) {
      LOGGER.warn("%d products are not declared in the compound list: %s",
          undeclaredProducts.size(), String.join(", ", undeclaredProducts));
    }
    if (!droppedCompounds.isEmpty()) {
      LOGGER.info("Dropped %d compounds that appear in no reaction", droppedCompounds.size());
    }
  }
}
