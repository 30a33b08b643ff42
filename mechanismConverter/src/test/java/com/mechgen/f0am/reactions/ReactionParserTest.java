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
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class ReactionParserTest {

  private ReactionParser parser;

  @Before
  public void setUp() {
    parser = new ReactionParser();
  }

  @Test
  public void testParseJoinsContinuationLines() throws Exception {
    List<String> lines = Arrays.asList(
        ".ACT",
        "ISOP ! 1 ISOPRENE",
        ".RXN",
        "R) 2.7E-11 -0.39 ; ISOP + OH = ISOPRENEr1_a",
        "R) 2.6E-12 -0.38 ; ISOPRENEr1_a + NO = 0.6 MACR +",
        "     0.4 MVK + HCHO",
        "R) PF=MACR ; MACR + HV = HCHO",
        ".",
        "R) 1.0 1.0 ; NOT + PARSED = X");

    List<RawReactionRecord> records = parser.parseReactions(lines);
    assertEquals(3, records.size());
    assertEquals("R) 2.7E-11 -0.39 ; ISOP + OH = ISOPRENEr1_a", records.get(0).getText());
    assertEquals("R) 2.6E-12 -0.38 ; ISOPRENEr1_a + NO = 0.6 MACR + 0.4 MVK + HCHO", records.get(1).getText());
    assertEquals("R) PF=MACR ; MACR + HV = HCHO", records.get(2).getText());
    assertEquals(1, records.get(0).getOrdinal());
    assertEquals(3, records.get(2).getOrdinal());
  }

  @Test
  public void testParseStripsHashCharacters() throws Exception {
    List<String> lines = Arrays.asList(
        ".RXN",
        "#R) 1.0E-11 0.5 ; A + B = C",
        "R) 2.0E-11 0.5 ; C = #D + E",
        "   # + F");

    List<RawReactionRecord> records = parser.parseReactions(lines);
    assertEquals(2, records.size());
    assertEquals("R) 1.0E-11 0.5 ; A + B = C", records.get(0).getText());
    assertEquals("R) 2.0E-11 0.5 ; C = D + E + F", records.get(1).getText());
  }

  @Test
  public void testBlockRunsToEndOfFileWithoutEndMarker() throws Exception {
    List<String> lines = Arrays.asList(
        ".RXN",
        "R) 1.0E-11 0.5 ; A + B = C",
        "",
        "R) 2.0E-11 0.5 ; C = D");

    List<RawReactionRecord> records = parser.parseReactions(lines);
    assertEquals(2, records.size());
    assertEquals("R) 2.0E-11 0.5 ; C = D", records.get(1).getText());
  }

  @Test
  public void testLinesBeforeFirstRecordAreIgnored() throws Exception {
    List<String> lines = Arrays.asList(".RXN", "stray text", "R) 1.0E-11 0.5 ; A = B");

    List<RawReactionRecord> records = parser.parseReactions(lines);
    assertEquals(1, records.size());
    assertEquals("R) 1.0E-11 0.5 ; A = B", records.get(0).getText());
  }

  @Test
  public void testEmptyBlock() throws Exception {
    assertEquals(0, parser.parseReactions(Arrays.asList(".RXN", ".")).size());
  }

  @Test(expected = MechanismFormatException.class)
  public void testMissingBlockStartIsFatal() throws Exception {
    parser.parseReactions(Arrays.asList(".ACT", "R) 1.0E-11 0.5 ; A = B"));
  }
}
