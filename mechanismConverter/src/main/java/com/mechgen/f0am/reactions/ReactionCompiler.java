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
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw MechGen reaction records into numbered F0AM reactions.
 *
 * Records are filtered in order; a record that fails a filter is counted in the run's {@link ConversionReport} and
 * skipped, and numbering continues from the last compiled reaction.  Filters, in order:
 * <ol>
 *   <li>the record must have a rate and an equation separated by ';', and the equation exactly one '='</li>
 *   <li>if a reference mechanism is given, its reactant side must not already be there</li>
 *   <li>its first reactant must be in the compound list</li>
 *   <li>if a radical cutoff is set, a radical-pool reactant must not be of a later generation than the cutoff</li>
 * </ol>
 */
public class ReactionCompiler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReactionCompiler.class);

  public static final String CLAUSE_DELIMITER = ";";
  public static final String EQUATION_SEPARATOR = "=";
  public static final String TERM_SEPARATOR = "+";
  // Volatility-basis-set species are lumped SOA proxies; their production is only tracked on request.
  public static final String AGGREGATE_PRODUCT_PREFIX = "VBS";

  private static final Pattern YIELD_PATTERN = Pattern.compile("\\d+\\.?\\d*|\\.\\d+");

  private final GenerationMode mode;
  private final String radicalPrefix;
  private final Integer radicalCutoff;
  private final boolean includeAggregateProducts;
  private final NamingRules namingRules;
  private final RateExpressionTranslator translator;

  /**
   * @param mode The generation mode the mechanism was produced in.
   * @param precursor The precursor the mechanism was generated for.
   * @param radicalCutoff The last radical generation to keep, or null (or 0) to keep all generations.
   * @param includeAggregateProducts Whether VBS products get balance lines.
   * @param namingRules The rules used to canonicalize equation identifiers.
   * @param translator The rate translator.
   */
  public ReactionCompiler(GenerationMode mode, String precursor, Integer radicalCutoff,
                          boolean includeAggregateProducts, NamingRules namingRules,
                          RateExpressionTranslator translator) {
    this.mode = mode;
    this.radicalPrefix = mode.radicalPrefix(NamingRules.normalizeHyphens(precursor));
    this.radicalCutoff = radicalCutoff == null || radicalCutoff == 0 ? null : radicalCutoff;
    this.includeAggregateProducts = includeAggregateProducts;
    this.namingRules = namingRules;
    this.translator = translator;
  }

  public CompilationResult compile(CompoundCatalog compounds, List<RawReactionRecord> records,
                                   ReferenceReactionSet referenceReactions) {
    return compile(compounds, records, referenceReactions, new PhotolysisNameAccumulator(), new ConversionReport());
  }

  /**
   * @param compounds The master compound list.
   * @param records The raw records in file order.
   * @param referenceReactions Reactions to leave out, or null to keep everything.
   * @param photolysisNames The run's photolysis names; extended as photolytic rates are translated.
   * @param report The run's report; skip counts are added to it.
   * @return The compiled reactions, the photolysis names and the report.
   */
  public CompilationResult compile(CompoundCatalog compounds, List<RawReactionRecord> records,
                                   ReferenceReactionSet referenceReactions,
                                   PhotolysisNameAccumulator photolysisNames, ConversionReport report) {
    List<CompiledReaction> compiled = new ArrayList<>();
    for (RawReactionRecord record : records) {
      report.recordRawRecord();
      CompiledReaction reaction =
          compileRecord(record, compiled.size() + 1, compounds, referenceReactions, photolysisNames, report);
      if (reaction != null) {
        compiled.add(reaction);
        report.recordCompiled();
      }
    }
    LOGGER.info("Compiled %d of %d reactions, %d photolysis rates",
        compiled.size(), records.size(), photolysisNames.size());
    return new CompilationResult(compiled, photolysisNames.getNames(), report);
  }

  private CompiledReaction compileRecord(RawReactionRecord record, int index, CompoundCatalog compounds,
                                         ReferenceReactionSet referenceReactions,
                                         PhotolysisNameAccumulator photolysisNames, ConversionReport report) {
    String[] clauses = StringUtils.splitPreserveAllTokens(record.getText(), CLAUSE_DELIMITER);
    if (clauses.length < 2) {
      return skip(record, SkipReason.MALFORMED_RECORD, report);
    }
    // Anything after a second ';' is a trailing comment.
    String rateClause = clauses[0].trim();
    String equation = namingRules.canonicalizeEquation(clauses[1].trim());

    String[] sides = StringUtils.splitPreserveAllTokens(equation, EQUATION_SEPARATOR);
    if (sides.length != 2) {
      return skip(record, SkipReason.MALFORMED_RECORD, report);
    }
    String reactantSide = sides[0].trim();

    if (referenceReactions != null && referenceReactions.contains(reactantSide)) {
      LOGGER.debug("Skipping reaction already in reference mechanism: %s", reactantSide);
      return skip(record, SkipReason.DUPLICATE_SUPPRESSED, report);
    }

    String[] reactantWords = StringUtils.split(reactantSide);
    if (reactantWords.length == 0 || !compounds.contains(reactantWords[0])) {
      return skip(record, SkipReason.UNDEFINED_SPECIES, report);
    }

    if (radicalCutoff != null && reactantSide.startsWith(radicalPrefix)) {
      long generation = radicalGeneration(reactantWords[0]);
      if (generation > radicalCutoff) {
        return skip(record, SkipReason.RADICAL_CUTOFF, report);
      }
    }

    String rateExpression = translateRate(stripRecordMarker(rateClause), photolysisNames, report);

    List<String> reactants = new ArrayList<>();
    for (String term : StringUtils.splitPreserveAllTokens(sides[0], TERM_SEPARATOR)) {
      reactants.add(term.trim());
    }
    List<ProductTerm> products = new ArrayList<>();
    for (String term : StringUtils.splitPreserveAllTokens(sides[1], TERM_SEPARATOR)) {
      ProductTerm product = parseProduct(term);
      if (product != null) {
        products.add(product);
      }
    }

    List<StoichiometryTerm> balance = new ArrayList<>();
    String radicalPool = namingRules.getRadicalPoolSpecies();
    for (String reactant : reactants) {
      if (CompiledReaction.PHOTON.equals(reactant) || reactant.isEmpty()) {
        continue;
      }
      balance.add(new StoichiometryTerm(reactant, -1.0));
      if (reactant.startsWith(radicalPrefix)) {
        balance.add(new StoichiometryTerm(radicalPool, -1.0));
      }
    }

    double radicalYield = 0.0;
    for (ProductTerm product : products) {
      String species = product.getSpecies();
      if (includeAggregateProducts || !species.startsWith(AGGREGATE_PRODUCT_PREFIX)) {
        balance.add(new StoichiometryTerm(species, product.getYield()));
        if (!compounds.contains(species)) {
          report.recordUndeclaredProduct(species);
        }
      }
      if (species.startsWith(radicalPrefix)) {
        radicalYield += product.getYield();
      }
    }
    if (radicalYield > 0) {
      balance.add(new StoichiometryTerm(radicalPool, radicalYield));
    }

    return new CompiledReaction(index, equation, rateExpression, reactants, products, balance, radicalYield);
  }

  private CompiledReaction skip(RawReactionRecord record, SkipReason reason, ConversionReport report) {
    LOGGER.debug("Skipping record %d (%s): %s", record.getOrdinal(), reason.getDescription(), record.getText());
    report.recordSkip(reason);
    return null;
  }

  private String translateRate(String rawRate, PhotolysisNameAccumulator photolysisNames, ConversionReport report) {
    if (translator.isPhotolysis(rawRate)) {
      return RateExpressionTranslator.PHOTOLYSIS_TAG + translator.translate(rawRate, photolysisNames);
    }
    String expression = translator.translate(rawRate, photolysisNames);
    if (expression.equals(rawRate)) {
      report.recordNonNumericRate();
    }
    return expression;
  }

  static String stripRecordMarker(String rateClause) {
    int marker = rateClause.indexOf(ReactionParser.RECORD_MARKER);
    return marker < 0 ? rateClause.trim() : rateClause.substring(marker + ReactionParser.RECORD_MARKER.length()).trim();
  }

  /**
   * Parses a product term of the form {@code [yield] species}.  Returns null for an empty term.
   */
  ProductTerm parseProduct(String term) {
    String[] words = StringUtils.split(term);
    if (words.length == 0) {
      return null;
    }
    if (words.length > 1 && YIELD_PATTERN.matcher(words[0]).matches()) {
      String species = StringUtils.join(words, ' ', 1, words.length);
      return new ProductTerm(Double.parseDouble(words[0]), species);
    }
    return new ProductTerm(1.0, term.trim());
  }

  /**
   * The generation number of a radical-pool identifier: the digits of the last underscore-separated segment after the
   * radical prefix that has any, e.g. 3 for {@code ISOPRENEr3_x} and 12 for {@code RAD1_12}.  Identifiers with no
   * digits are treated as generation 0.
   */
  long radicalGeneration(String identifier) {
    String rest = identifier.startsWith(radicalPrefix) ? identifier.substring(radicalPrefix.length()) : identifier;
    String[] segments = StringUtils.splitPreserveAllTokens(rest, '_');
    for (int i = segments.length - 1; i >= 0; i--) {
      String digits = StringUtils.getDigits(segments[i]);
      if (!digits.isEmpty()) {
        // Anything too long for a long is certainly beyond the cutoff.
        return digits.length() > 18 ? Long.MAX_VALUE : Long.parseLong(digits);
      }
    }
    return 0;
  }

  public GenerationMode getMode() {
    return mode;
  }

  public String getRadicalPrefix() {
    return radicalPrefix;
  }
}
