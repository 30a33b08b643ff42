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
import com.mechgen.f0am.SkipReason;
import com.mechgen.f0am.naming.NamingRules;
import com.mechgen.f0am.rates.PhotolysisNameAccumulator;
import com.mechgen.f0am.rates.RateExpressionTranslator;
import com.mechgen.f0am.species.CompoundCatalog;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ReactionCompilerTest {

  private static final String PRECURSOR = "ISOPRENE";

  private NamingRules namingRules;
  private CompoundCatalog catalog;

  @Before
  public void setUp() {
    namingRules = new NamingRules();
    catalog = new CompoundCatalog(
        Arrays.asList("SumRO2", "SumRCO3", "ISOP", "OH", "NO", "MACR", "HCHO", "TM2C5E4O", "VBS1",
            "ISOPRENEr1_a", "ISOPRENEr2_x", "ISOPRENEr3_x", "RAD1_2", "RAD1_5"),
        Collections.emptyList());
  }

  private ReactionCompiler compiler(GenerationMode mode, Integer cutoff, boolean aggregates) {
    return new ReactionCompiler(mode, PRECURSOR, cutoff, aggregates, namingRules, new RateExpressionTranslator());
  }

  private static List<RawReactionRecord> records(String... texts) {
    List<RawReactionRecord> records = new ArrayList<>();
    for (String text : texts) {
      records.add(new RawReactionRecord(records.size() + 1, text));
    }
    return records;
  }

  @Test
  public void testIndicesAreDenseOverRetainedReactions() {
    CompilationResult result = compiler(GenerationMode.SINGLE, null, false).compile(catalog, records(
        "R) 2.7E-11 -0.39 ; ISOP + OH = ISOPRENEr1_a",
        "R) 1.0E-11 0.5 ISOP + NO = MACR",
        "R) 1.0E-11 0.5 ; UNKNOWN + OH = MACR",
        "R) 2.6E-12 -0.38 ; ISOPRENEr1_a + NO = MACR + HCHO",
        "R) 1.0E-11 0.5 ; MACR + OH = = HCHO",
        "R) PF=MACR ; MACR + HV = HCHO"), null);

    List<CompiledReaction> reactions = result.getReactions();
    assertEquals(3, reactions.size());
    for (int i = 0; i < reactions.size(); i++) {
      assertEquals(i + 1, reactions.get(i).getIndex());
    }
    assertEquals("ISOPRENEr1_a + NO = MACR + HCHO", reactions.get(1).getEquation());

    ConversionReport report = result.getReport();
    assertEquals(6, report.getRawRecords());
    assertEquals(3, report.getCompiledReactions());
    assertEquals(2, report.getSkipCount(SkipReason.MALFORMED_RECORD));
    assertEquals(1, report.getSkipCount(SkipReason.UNDEFINED_SPECIES));
    assertEquals(3, report.getTotalSkipped());
  }

  @Test
  public void testFormattedBlock() {
    CompilationResult result = compiler(GenerationMode.SINGLE, null, false).compile(catalog, records(
        "R) 2.7E-11 -0.39 ; ISOP + OH = ISOPRENEr1_a",
        "R) 2.6E-12 -0.38 ; ISOPRENEr1_a + NO = 0.6 MACR + 0.4 2M2C5E4O + HCHO + 0.05 VBS1"), null);

    String expectedFirst = String.join("\n",
        "%   1, <R001>",
        "i = i + 1;",
        "Rnames{i} = 'ISOP + OH = ISOPRENEr1_a';",
        "k(:,i) = 2.7e-11 .* exp(196.2556./T);",
        "Gstr{i,1} = 'ISOP'; Gstr{i,2} = 'OH'; ",
        "fISOP(i) = fISOP(i) - 1;",
        "fOH(i) = fOH(i) - 1;",
        "fISOPRENEr1_a(i) = fISOPRENEr1_a(i) + 1.0;",
        "fSumRO2(i) = fSumRO2(i) + 1.0;");
    assertEquals(expectedFirst, result.getReactions().get(0).toMatlab());

    String expectedSecond = String.join("\n",
        "%   2, <R002>",
        "i = i + 1;",
        "Rnames{i} = 'ISOPRENEr1_a + NO = 0.6 MACR + 0.4 TM2C5E4O + HCHO + 0.05 VBS1';",
        "k(:,i) = 2.6e-12 .* exp(191.2234./T);",
        "Gstr{i,1} = 'ISOPRENEr1_a'; Gstr{i,2} = 'NO'; ",
        "fISOPRENEr1_a(i) = fISOPRENEr1_a(i) - 1;",
        "fSumRO2(i) = fSumRO2(i) - 1;",
        "fNO(i) = fNO(i) - 1;",
        "fMACR(i) = fMACR(i) + 0.6;",
        "fTM2C5E4O(i) = fTM2C5E4O(i) + 0.4;",
        "fHCHO(i) = fHCHO(i) + 1.0;");
    assertEquals(expectedSecond, result.getReactions().get(1).toMatlab());
  }

  @Test
  public void testStoichiometryDeltas() {
    CompilationResult result = compiler(GenerationMode.SINGLE, null, false).compile(catalog, records(
        "R) 2.6E-12 -0.38 ; ISOPRENEr1_a + NO = 0.5 ISOPRENEr2_x + 0.5 ISOPRENEr3_x + NO"), null);

    CompiledReaction reaction = result.getReactions().get(0);
    Map<String, Double> deltas = reaction.getStoichiometryDeltas();
    assertEquals(-1.0, deltas.get("ISOPRENEr1_a"), 1e-9);
    assertEquals(0.0, deltas.get("NO"), 1e-9);
    assertEquals(0.5, deltas.get("ISOPRENEr2_x"), 1e-9);
    // -1 for the consumed radical, +1 for the two half-yield radicals produced.
    assertEquals(0.0, deltas.get("SumRO2"), 1e-9);
    assertEquals(1.0, reaction.getRadicalPoolDelta(), 1e-9);
    for (String species : deltas.keySet()) {
      assertTrue(species, catalog.contains(species));
    }
  }

  @Test
  public void testRadicalPoolLineOnlyWhenProductsArePositive() {
    CompilationResult result = compiler(GenerationMode.SINGLE, null, false).compile(catalog, records(
        "R) 2.6E-12 -0.38 ; ISOPRENEr1_a + NO = MACR"), null);

    String block = result.getReactions().get(0).toMatlab();
    assertTrue(block.contains("fSumRO2(i) = fSumRO2(i) - 1;"));
    assertFalse(block.contains("fSumRO2(i) = fSumRO2(i) +"));
    assertEquals(0.0, result.getReactions().get(0).getRadicalPoolDelta(), 0.0);
  }

  @Test
  public void testPhotonIsDeclaredNowhereButKeptInEquation() {
    CompilationResult result = compiler(GenerationMode.SINGLE, null, false).compile(catalog, records(
        "R) PF=MACR QY=0.5 ; MACR + HV = HCHO",
        "R) PF=HCHO_R ; HCHO + HV = NO",
        "R) PF=MACR ; MACR + HV = OH"), null);

    CompiledReaction reaction = result.getReactions().get(0);
    assertEquals("MACR + HV = HCHO", reaction.getEquation());
    assertEquals("JMACR * 0.5", reaction.getRateExpression());
    assertEquals(Arrays.asList("MACR", "HV"), reaction.getReactants());
    assertEquals(Collections.singletonList("MACR"), reaction.getDeclaredReactants());
    assertFalse(reaction.getStoichiometryDeltas().containsKey("HV"));
    assertFalse(reaction.toMatlab().contains("Gstr{i,2}"));
    assertEquals(Arrays.asList("MACR", "HCHO_R"), result.getPhotolysisNames());
  }

  @Test
  public void testReferenceReactionsAreSuppressed() {
    ReferenceReactionSet reference = new ReferenceReactionSet(new HashSet<>(Arrays.asList("ISOP + OH")));
    CompilationResult result = compiler(GenerationMode.SINGLE, null, false).compile(catalog, records(
        "R) 2.7E-11 -0.39 ; ISOP  +  OH = ISOPRENEr1_a",
        "R) 1.0E-11 0.5 ; ISOP + NO = MACR"), reference);

    assertEquals(1, result.getReactions().size());
    assertEquals(1, result.getReactions().get(0).getIndex());
    assertEquals("ISOP + NO = MACR", result.getReactions().get(0).getEquation());
    assertEquals(1, result.getReport().getSkipCount(SkipReason.DUPLICATE_SUPPRESSED));
  }

  @Test
  public void testSingleGenerationRadicalCutoff() {
    CompilationResult result = compiler(GenerationMode.SINGLE, 2, false).compile(catalog, records(
        "R) 1.0E-11 0.5 ; ISOPRENEr3_x + NO = MACR",
        "R) 1.0E-11 0.5 ; ISOPRENEr2_x + NO = MACR",
        "R) 1.0E-11 0.5 ; RAD1_5 + NO = MACR"), null);

    assertEquals(2, result.getReactions().size());
    assertTrue(result.getReactions().get(0).getEquation().startsWith("ISOPRENEr2_x"));
    // RAD is only the radical marker in multi-generation mechanisms.
    assertTrue(result.getReactions().get(1).getEquation().startsWith("RAD1_5"));
    assertEquals(1, result.getReport().getSkipCount(SkipReason.RADICAL_CUTOFF));
  }

  @Test
  public void testMultiGenerationRadicalCutoff() {
    CompilationResult result = compiler(GenerationMode.MULTI, 2, false).compile(catalog, records(
        "R) 1.0E-11 0.5 ; RAD1_5 + NO = MACR",
        "R) 1.0E-11 0.5 ; RAD1_2 + NO = MACR + RAD1_5",
        "R) 1.0E-11 0.5 ; ISOPRENEr3_x + NO = MACR"), null);

    assertEquals(2, result.getReactions().size());
    CompiledReaction radical = result.getReactions().get(0);
    assertEquals("RAD1_2 + NO = MACR + RAD1_5", radical.getEquation());
    assertTrue(radical.toMatlab().contains("fSumRO2(i) = fSumRO2(i) - 1;"));
    assertTrue(radical.toMatlab().contains("fSumRO2(i) = fSumRO2(i) + 1.0;"));
    assertFalse(result.getReactions().get(1).toMatlab().contains("fSumRO2"));
  }

  @Test
  public void testCutoffDisabledKeepsAllGenerations() {
    CompilationResult result = compiler(GenerationMode.SINGLE, 0, false).compile(catalog, records(
        "R) 1.0E-11 0.5 ; ISOPRENEr3_x + NO = MACR"), null);
    assertEquals(1, result.getReactions().size());
  }

  @Test
  public void testRadicalGeneration() {
    ReactionCompiler single = compiler(GenerationMode.SINGLE, 2, false);
    assertEquals(3, single.radicalGeneration("ISOPRENEr3_x"));
    assertEquals(12, single.radicalGeneration("ISOPRENEr1_12"));
    assertEquals(0, single.radicalGeneration("ISOPRENEr_x"));
    ReactionCompiler multi = compiler(GenerationMode.MULTI, 2, false);
    assertEquals(5, multi.radicalGeneration("RAD1_5"));
  }

  @Test
  public void testAggregateProductsBalancedOnlyOnRequest() {
    List<RawReactionRecord> input = records("R) 1.0E-11 0.5 ; MACR + OH = 0.1 VBS1 + HCHO");

    CompiledReaction excluded = compiler(GenerationMode.SINGLE, null, false).compile(catalog, input, null)
        .getReactions().get(0);
    assertEquals("MACR + OH = 0.1 VBS1 + HCHO", excluded.getEquation());
    assertFalse(excluded.getStoichiometryDeltas().containsKey("VBS1"));

    CompiledReaction included = compiler(GenerationMode.SINGLE, null, true).compile(catalog, input, null)
        .getReactions().get(0);
    assertEquals(0.1, included.getStoichiometryDeltas().get("VBS1"), 1e-9);
  }

  @Test
  public void testNonNumericRateIsCountedAndPassedThrough() {
    CompilationResult result = compiler(GenerationMode.SINGLE, null, false).compile(catalog, records(
        "R) KNO2OH ; NO + OH = HCHO"), null);
    assertEquals("KNO2OH", result.getReactions().get(0).getRateExpression());
    assertEquals(1, result.getReport().getNonNumericRates());
  }

  @Test
  public void testUndeclaredProductsAreReported() {
    CompilationResult result = compiler(GenerationMode.SINGLE, null, false).compile(catalog, records(
        "R) 1.0E-11 0.5 ; NO + OH = HONO"), null);
    assertEquals(1, result.getReactions().size());
    assertEquals(Collections.singleton("HONO"), result.getReport().getUndeclaredProducts());
  }

  @Test
  public void testPhotolysisNamesSharedAcrossCompilationsOfOneRun() {
    PhotolysisNameAccumulator names = new PhotolysisNameAccumulator();
    ReactionCompiler compiler = compiler(GenerationMode.SINGLE, null, false);
    compiler.compile(catalog, records("R) PF=MACR ; MACR + HV = HCHO"), null, names, new ConversionReport());
    CompilationResult second = compiler.compile(
        catalog, records("R) PF=MACR ; MACR + HV = OH", "R) PF=NO2 ; NO + HV = OH"), null, names,
        new ConversionReport());
    assertEquals(Arrays.asList("MACR", "NO2"), second.getPhotolysisNames());
    assertEquals(1, second.getReactions().get(0).getIndex());
  }

  @Test
  public void testParseProduct() {
    ReactionCompiler compiler = compiler(GenerationMode.SINGLE, null, false);
    ProductTerm withYield = compiler.parseProduct(" 0.25 MACR ");
    assertEquals(0.25, withYield.getYield(), 0.0);
    assertEquals("MACR", withYield.getSpecies());
    ProductTerm plain = compiler.parseProduct("HCHO");
    assertEquals(1.0, plain.getYield(), 0.0);
    assertEquals("HCHO", plain.getSpecies());
    // Exponent notation is not a yield.
    assertEquals("1e-3 MACR", compiler.parseProduct("1e-3 MACR").getSpecies());
  }
}
