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

package com.mechgen.f0am.rates;

import com.mechgen.f0am.naming.NamingRules;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates MechGen rate parameters into F0AM rate expressions.
 *
 * Thermal rates are given as {@code A Ea [B]} with the activation energy in kcal/mol; they become
 * {@code A .* exp(-Ea/R./T) [.* (T./300).^B]}.  Photolysis rates reference a photolysis file with {@code PF=<name>}
 * and an optional quantum yield {@code QY=<value>}; they become {@code <name> [* <qy>]}, and the name is recorded in
 * the run's {@link PhotolysisNameAccumulator}.  Anything else is returned untouched.
 */
public class RateExpressionTranslator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RateExpressionTranslator.class);

  // Gas constant in kcal/(mol*K), negated so the result is the exponent's coefficient of 1/T.
  public static final double GAS_CONSTANT = -0.001987204258640;
  public static final int REFERENCE_TEMPERATURE = 300;
  public static final String PHOTOLYSIS_TAG = "J";

  private static final String PHOTOLYSIS_MARKER = "PF=";
  private static final Pattern PHOTOLYSIS_FILE_PATTERN = Pattern.compile("PF=(\\S+)");
  private static final Pattern QUANTUM_YIELD_PATTERN = Pattern.compile("QY=([0-9.eE\\-]+)");
  private static final Pattern NUMBER_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  // MechGen still emits the old name of the propanal absorption file.
  private static final String LEGACY_PROPANAL_FILE = "C2CHOabs";
  private static final String PROPANAL_FILE = "C2CHO";

  public boolean isPhotolysis(String rawRateText) {
    return rawRateText.contains(PHOTOLYSIS_MARKER) && PHOTOLYSIS_FILE_PATTERN.matcher(rawRateText).find();
  }

  /**
   * @param rawRateText The rate parameters of one reaction, without the record marker.
   * @param photolysisNames The run's photolysis names; photolysis files seen here are appended to it.
   * @return The translated expression, or {@code rawRateText} itself if it is neither form.  Photolytic results
   * carry no {@link #PHOTOLYSIS_TAG}; callers prepend it.
   */
  public String translate(String rawRateText, PhotolysisNameAccumulator photolysisNames) {
    if (rawRateText.contains(PHOTOLYSIS_MARKER)) {
      Matcher product = PHOTOLYSIS_FILE_PATTERN.matcher(rawRateText);
      if (product.find()) {
        return translatePhotolysis(rawRateText, product.group(1), photolysisNames);
      }
    }
    return translateArrhenius(rawRateText);
  }

  private String translatePhotolysis(String rawRateText, String fileName, PhotolysisNameAccumulator photolysisNames) {
    String name = NamingRules.normalizeHyphens(fileName);
    if (LEGACY_PROPANAL_FILE.equals(name)) {
      name = PROPANAL_FILE;
    }
    if (photolysisNames.register(name)) {
      LOGGER.debug("New photolysis rate %s", name);
    }

    Matcher quantumYield = QUANTUM_YIELD_PATTERN.matcher(rawRateText);
    if (quantumYield.find()) {
      return String.format("%s * %s", name, quantumYield.group(1));
    }
    return name;
  }

  String translateArrhenius(String rawRateText) {
    String[] parts = StringUtils.split(rawRateText);
    if (parts == null || parts.length < 2 || parts.length > 3) {
      return rawRateText;
    }
    if (!NUMBER_PATTERN.matcher(parts[0]).matches() || !NUMBER_PATTERN.matcher(parts[1]).matches()) {
      LOGGER.debug("Rate '%s' is not numeric, passing through", rawRateText);
      return rawRateText;
    }

    double a = Double.parseDouble(parts[0]);
    double e = Double.parseDouble(parts[1]) / GAS_CONSTANT;
    String expression = String.format("%s .* exp(%s./T)",
        MatlabNumberFormat.format(a), MatlabNumberFormat.formatFixed(e, 4));
    if (parts.length == 3) {
      expression = String.format("%s .* (T./%d).^%s", expression, REFERENCE_TEMPERATURE, parts[2]);
    }
    return expression;
  }
}
