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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mechgen.f0am.naming.NamingRules;
import com.mechgen.f0am.rates.PhotolysisNameAccumulator;
import com.mechgen.f0am.rates.RateExpressionTranslator;
import com.mechgen.f0am.reactions.CompilationResult;
import com.mechgen.f0am.reactions.GenerationMode;
import com.mechgen.f0am.reactions.RawReactionRecord;
import com.mechgen.f0am.reactions.ReactionCompiler;
import com.mechgen.f0am.reactions.ReactionParser;
import com.mechgen.f0am.reactions.ReferenceMechanismLoader;
import com.mechgen.f0am.reactions.ReferenceReactionSet;
import com.mechgen.f0am.species.CompoundCatalog;
import com.mechgen.f0am.species.SpeciesCatalogBuilder;
import com.mechgen.f0am.utils.CLIUtil;
import com.mechgen.f0am.utils.FileChecker;
import com.mechgen.f0am.writer.MechanismWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a MechGen reaction file into an F0AM mechanism script.
 *
 * The run reads the species sections into a compound list, compiles the reaction records against it (leaving out
 * anything already in the reference mechanism), drops compounds no reaction uses, and writes the result.
 */
public class MechanismConverter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MechanismConverter.class);

  private static final String OPTION_CONFIG = "c";
  private static final String OPTION_INPUT = "i";
  private static final String OPTION_OUTPUT = "o";
  private static final String OPTION_REFERENCE = "r";
  private static final String OPTION_TARGET = "t";
  private static final String OPTION_GENERATION = "g";
  private static final String OPTION_MIN_YIELD = "y";
  private static final String OPTION_RADICAL_CUTOFF = "x";
  private static final String OPTION_AGGREGATE_PRODUCTS = "a";

  static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_CONFIG)
        .argName("config file")
        .desc("A JSON file with the conversion settings; other options override its values")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_INPUT)
        .argName("reaction file")
        .desc("The MechGen reaction file to convert")
        .hasArg()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("mechanism file")
        .desc("Where to write the F0AM mechanism")
        .hasArg()
        .longOpt("output")
    );
    add(Option.builder(OPTION_REFERENCE)
        .argName("reference mechanism")
        .desc("An F0AM base mechanism whose reactions should be left out")
        .hasArg()
        .longOpt("reference")
    );
    add(Option.builder(OPTION_TARGET)
        .argName("precursor")
        .desc("The precursor the mechanism was generated for, e.g. ISOPRENE")
        .hasArg()
        .longOpt("target")
    );
    add(Option.builder(OPTION_GENERATION)
        .argName("Single|Multi")
        .desc("Whether MechGen generated a single- or multi-generation mechanism")
        .hasArg()
        .longOpt("generation")
    );
    add(Option.builder(OPTION_MIN_YIELD)
        .argName("min yield")
        .desc("The MinYld MechGen ran with; recorded in the output header")
        .hasArg()
        .longOpt("min-yield")
    );
    add(Option.builder(OPTION_RADICAL_CUTOFF)
        .argName("generation")
        .desc("Leave out reactions of radicals beyond this generation")
        .hasArg()
        .longOpt("radical-cutoff")
    );
    add(Option.builder(OPTION_AGGREGATE_PRODUCTS)
        .desc("Write balance lines for VBS (SOA proxy) products")
        .longOpt("aggregate-products")
    );
  }};

  private static final String HELP_MESSAGE = StringUtils.join(new String[] {
      "This class converts a MechGen reaction file into an F0AM mechanism, leaving out reactions already in an ",
      "optional reference mechanism."
  }, "");

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final ConverterConfig config;
  private final NamingRules namingRules;

  public MechanismConverter(ConverterConfig config) {
    if (StringUtils.isBlank(config.getTargetReactant())) {
      throw new IllegalArgumentException("A target reactant is required");
    }
    this.config = config;
    this.namingRules = new NamingRules(config.getNameReplacements());
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(MechanismConverter.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    ConverterConfig config;
    try {
      config = buildConfig(cl);
    } catch (IllegalArgumentException e) {
      cliUtil.failWithMessage(e.getMessage());
      return;
    }

    MechanismConverter converter = new MechanismConverter(config);
    try {
      converter.run();
    } catch (MechanismFormatException e) {
      LOGGER.error("%s is not a MechGen reaction file: %s", config.getInputFile(), e.getMessage());
      System.exit(1);
    }
  }

  static ConverterConfig buildConfig(CommandLine cl) throws IOException {
    ConverterConfig config = new ConverterConfig();
    if (cl.hasOption(OPTION_CONFIG)) {
      File configFile = new File(cl.getOptionValue(OPTION_CONFIG));
      FileChecker.verifyInputFile(configFile);
      config = OBJECT_MAPPER.readValue(configFile, new TypeReference<ConverterConfig>() {});
    }

    if (cl.hasOption(OPTION_TARGET)) {
      config.setTargetReactant(cl.getOptionValue(OPTION_TARGET));
    }
    if (cl.hasOption(OPTION_GENERATION)) {
      config.setGeneration(cl.getOptionValue(OPTION_GENERATION));
    }
    if (cl.hasOption(OPTION_MIN_YIELD)) {
      config.setMinYield(cl.getOptionValue(OPTION_MIN_YIELD));
    }
    if (cl.hasOption(OPTION_INPUT)) {
      config.setInputFile(cl.getOptionValue(OPTION_INPUT));
    }
    if (cl.hasOption(OPTION_OUTPUT)) {
      config.setOutputFile(cl.getOptionValue(OPTION_OUTPUT));
    }
    if (cl.hasOption(OPTION_REFERENCE)) {
      config.setReferenceFile(cl.getOptionValue(OPTION_REFERENCE));
    }
    if (cl.hasOption(OPTION_RADICAL_CUTOFF)) {
      String cutoff = cl.getOptionValue(OPTION_RADICAL_CUTOFF);
      try {
        config.setRadicalCutoff(Integer.parseInt(cutoff));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(String.format("Radical cutoff must be an integer, got '%s'", cutoff));
      }
    }
    if (cl.hasOption(OPTION_AGGREGATE_PRODUCTS)) {
      config.setIncludeAggregateProducts(true);
    }

    if (StringUtils.isBlank(config.getTargetReactant())) {
      throw new IllegalArgumentException("A target reactant must be given, either with -t or in the config file");
    }
    // Fail on a bad mode before any file is read.
    GenerationMode.fromLabel(config.getGeneration());
    return config;
  }

  /**
   * Reads the configured input and reference files, converts, and writes the output file.
   */
  public ConversionResult run() throws IOException, MechanismFormatException {
    LOGGER.info("Starting MechGen to F0AM conversion for %s (%s generation)",
        config.getTargetReactant(), config.getGeneration());

    ReferenceReactionSet reference = null;
    if (config.getReferenceFile() != null) {
      LOGGER.info("Reading reference reactions from %s", config.getReferenceFile());
      reference = new ReferenceMechanismLoader(namingRules).load(new File(config.getReferenceFile()));
    }

    File inputFile = new File(config.getInputFile());
    FileChecker.verifyInputFile(inputFile);
    List<String> lines = Files.readAllLines(inputFile.toPath(), StandardCharsets.UTF_8);

    ConversionResult result = convert(lines, reference);

    File outputFile = new File(config.getOutputFile());
    FileChecker.verifyOutputFile(outputFile);
    LOGGER.info("Writing mechanism to %s", outputFile.getPath());
    try (Writer out = Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8)) {
      write(result, out);
    }
    LOGGER.info("Mechanism file successfully written");
    return result;
  }

  /**
   * Converts the lines of a MechGen reaction file.  Each call has its own photolysis names and report, so a converter
   * may be reused for several runs.
   * @param lines The reaction file's lines.
   * @param reference Reactions to leave out, or null.
   * @return The compounds, reactions and diagnostics of the run.
   * @throws MechanismFormatException If a species section or the reaction block is missing.
   */
  public ConversionResult convert(List<String> lines, ReferenceReactionSet reference)
      throws MechanismFormatException {
    SpeciesCatalogBuilder catalogBuilder = new SpeciesCatalogBuilder(namingRules);
    LOGGER.info("Creating compounds list");
    CompoundCatalog catalog = catalogBuilder.buildCompounds(lines, config.getDefaultCompounds());

    LOGGER.info("Parsing reaction equations");
    List<RawReactionRecord> records = new ReactionParser().parseReactions(lines);

    ReactionCompiler compiler = new ReactionCompiler(
        GenerationMode.fromLabel(config.getGeneration()), config.getTargetReactant(), config.getRadicalCutoff(),
        config.getIncludeAggregateProducts(), namingRules, new RateExpressionTranslator());
    ConversionReport report = new ConversionReport();
    CompilationResult compilation =
        compiler.compile(catalog, records, reference, new PhotolysisNameAccumulator(), report);

    LOGGER.info("Cleaning null compounds");
    Pair<List<String>, List<String>> cleaned =
        SpeciesCatalogBuilder.cleanNullCompounds(catalog.getAllCompounds(), compilation.getReactionTexts());
    report.recordDroppedCompounds(cleaned.getRight());
    LOGGER.info("Initial compounds count: %d, after cleaning: %d (removed %d)",
        catalog.size(), cleaned.getLeft().size(), cleaned.getRight().size());

    report.logSummary();
    return new ConversionResult(cleaned.getLeft(), cleaned.getRight(), compilation);
  }

  public void write(ConversionResult result, Writer out) throws IOException {
    new MechanismWriter(config.getTargetReactant(), config.getMinYield())
        .write(out, result.getCompounds(), result.getReactions());
  }

  public ConverterConfig getConfig() {
    return config;
  }
}
