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

package com.mechgen.f0am.utils;

import com.mechgen.f0am.MechanismFormatException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the lines between a start marker and an end marker.  Markers match only when a whole line equals them
 * (trailing line terminators and whitespace ignored).  The start line and end line are excluded from the result.
 */
public class SectionScanner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SectionScanner.class);

  public enum State {
    SEEKING_START,
    IN_SECTION,
    DONE,
  }

  private final String startMarker;
  private final String endMarker;
  private final boolean endRequired;

  /**
   * @param startMarker The line that opens the section; its absence is a format error.
   * @param endMarker The line that closes the section, or null if the section always runs to end of file.
   * @param endRequired If true, reaching end of file before the end marker is a format error.
   */
  public SectionScanner(String startMarker, String endMarker, boolean endRequired) {
    this.startMarker = startMarker;
    this.endMarker = endMarker;
    this.endRequired = endRequired;
  }

  public List<String> scan(List<String> lines) throws MechanismFormatException {
    State state = State.SEEKING_START;
    List<String> section = new ArrayList<>();

    for (String line : lines) {
      String marker = StringUtils.stripEnd(line, null);
      switch (state) {
        case SEEKING_START:
          if (marker.equals(startMarker)) {
            state = State.IN_SECTION;
          }
          break;
        case IN_SECTION:
          if (endMarker != null && marker.equals(endMarker)) {
            state = State.DONE;
          } else {
            section.add(line);
          }
          break;
        case DONE:
          break;
      }
      if (state == State.DONE) {
        break;
      }
    }

    if (state == State.SEEKING_START) {
      throw new MechanismFormatException(String.format("Unable to find section start marker '%s'", startMarker));
    }
    if (state == State.IN_SECTION && endMarker != null) {
      if (endRequired) {
        throw new MechanismFormatException(String.format(
            "Section '%s' is not terminated by '%s'", startMarker, endMarker));
      }
      LOGGER.debug("No '%s' after '%s', section runs to end of file", endMarker, startMarker);
    }
    return section;
  }

  public String getStartMarker() {
    return startMarker;
  }

  public String getEndMarker() {
    return endMarker;
  }
}
