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

import com.mechgen.f0am.MechanismFormatException;
import com.mechgen.f0am.utils.SectionScanner;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the raw reaction records from the .RXN block of a MechGen reaction file.  A record starts on a line beginning
 * with "R)" and continues over any following lines until the next record; the block ends at a line holding a single
 * "." or at end of file.
 */
public class ReactionParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReactionParser.class);

  public static final String BLOCK_START = ".RXN";
  public static final String BLOCK_END = ".";
  public static final String RECORD_MARKER = "R)";

  public List<RawReactionRecord> parseReactions(List<String> lines) throws MechanismFormatException {
    List<String> block = new SectionScanner(BLOCK_START, BLOCK_END, false).scan(lines);

    List<RawReactionRecord> records = new ArrayList<>();
    StringBuilder current = null;
    int orphans = 0;

    for (String rawLine : block) {
      String line = StringUtils.remove(rawLine, '#').trim();
      if (line.startsWith(RECORD_MARKER)) {
        if (current != null) {
          records.add(new RawReactionRecord(records.size() + 1, current.toString()));
        }
        current = new StringBuilder(line);
      } else if (line.isEmpty()) {
        continue;
      } else if (current == null) {
        orphans++;
      } else {
        current.append(' ').append(line);
      }
    }
    if (current != null) {
      records.add(new RawReactionRecord(records.size() + 1, current.toString()));
    }

    if (orphans > 0) {
      LOGGER.warn("Ignored %d lines before the first reaction record", orphans);
    }
    LOGGER.info("Found %d raw reactions", records.size());
    return records;
  }
}
