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
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SectionScannerTest {

  private static final List<String> LINES = Arrays.asList(
      "header", ".ACT", "a", "b", ".RXN", "R) x", ".", "trailer");

  @Test
  public void testScanReturnsLinesBetweenMarkers() throws Exception {
    List<String> section = new SectionScanner(".ACT", ".RXN", true).scan(LINES);
    assertEquals(Arrays.asList("a", "b"), section);
  }

  @Test
  public void testMarkersMatchWholeLinesOnly() throws Exception {
    List<String> lines = Arrays.asList(".ACTIVE", " .ACT", ".ACT\r", "a", ".RXN   ", "b");
    assertEquals(Collections.singletonList("a"), new SectionScanner(".ACT", ".RXN", true).scan(lines));
  }

  @Test
  public void testMissingEndRunsToEndOfFile() throws Exception {
    List<String> section = new SectionScanner(".RXN", ".END", false).scan(LINES);
    assertEquals(Arrays.asList("R) x", ".", "trailer"), section);
  }

  @Test
  public void testNullEndRunsToEndOfFile() throws Exception {
    List<String> section = new SectionScanner(".", null, false).scan(LINES);
    assertEquals(Collections.singletonList("trailer"), section);
  }

  @Test(expected = MechanismFormatException.class)
  public void testMissingEndFailsWhenRequired() throws Exception {
    new SectionScanner(".RXN", ".END", true).scan(LINES);
  }

  @Test
  public void testMissingStartFails() {
    try {
      new SectionScanner(".STS", ".RXN", false).scan(LINES);
    } catch (MechanismFormatException e) {
      assertTrue(e.getMessage().contains(".STS"));
      return;
    }
    throw new AssertionError("Expected a MechanismFormatException");
  }

  @Test
  public void testEmptySection() throws Exception {
    List<String> lines = Arrays.asList(".ACT", ".RXN");
    assertTrue(new SectionScanner(".ACT", ".RXN", true).scan(lines).isEmpty());
  }
}
