package com.gentoro.lexgraph;

import com.gentoro.lexgraph.exception.StateException;
import com.gentoro.lexgraph.export.JsonExporter;
import com.gentoro.lexgraph.ingest.GraphIngestionService;
import com.gentoro.lexgraph.ingest.IngestionStats;
import com.gentoro.lexgraph.loader.BatchLoader;
import com.gentoro.lexgraph.loader.GraphQueryDriver;
import com.gentoro.lexgraph.loader.spi.BatchLoaderFactory;
import com.gentoro.lexgraph.loader.spi.BatchLoaderProvider;
import com.gentoro.lexgraph.markup.MarkupDialect;
import com.gentoro.lexgraph.model.StructuralUnit;
import com.gentoro.lexgraph.model.UnitKind;
import com.gentoro.lexgraph.model.UnitTree;
import com.gentoro.lexgraph.parser.HierarchyParser;
import com.gentoro.lexgraph.parser.TableNormalizer;
import com.gentoro.lexgraph.projection.GraphProjection;
import com.gentoro.lexgraph.projection.GraphProjector;
import com.gentoro.lexgraph.reference.ExtractionResult;
import com.gentoro.lexgraph.reference.Reference;
import com.gentoro.lexgraph.reference.ReferenceExtractor;
import com.gentoro.lexgraph.report.ConsoleReport;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: owns the configuration and the pipeline components, and runs one
 * parse (and optionally ingest) of a single document as described by the startup parameters.
 */
public class LexGraph {

  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(LexGraph.class);

  private static final int DEFAULT_HIERARCHY_DEPTH = 3;
  private static final int SAMPLE_SECTIONS = 5;

  private final StartupParameters startupParameters;
  private final ConsoleReport report;
  private ConfigurationProvider configurationProvider;
  private HierarchyParser parser;
  private ReferenceExtractor extractor;
  private GraphProjector projector;
  private JsonExporter exporter;

  private UnitTree tree;
  private ExtractionResult extraction;
  private GraphProjection projection;
  private IngestionStats ingestionStats;

  public LexGraph(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), System.out);
  }

  public LexGraph(StartupParameters startupParameters, PrintStream out) {
    this.startupParameters = startupParameters;
    this.report = new ConsoleReport(out);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.lexgraph.logging.LoggingService.applyConfiguration(configuration());

    Configuration cfg = configuration();
    MarkupDialect dialect =
        MarkupDialect.load(cfg.getString("parser.dialect", MarkupDialect.USLM_LOCATION));
    int maxSections =
        startupParameters
            .getOptionalInt("max-sections")
            .orElse(ConfigurationProvider.resolvedInt(cfg, "parser.maxSections", 0));
    this.parser = new HierarchyParser(dialect, new TableNormalizer(), maxSections);
    this.extractor =
        new ReferenceExtractor(
            ConfigurationProvider.resolvedInt(
                cfg, "references.contextWindow", ReferenceExtractor.DEFAULT_CONTEXT_WINDOW),
            ConfigurationProvider.resolvedInt(cfg, "references.parallelism", 1));
    this.projector = new GraphProjector();
    this.exporter = new JsonExporter();
    log.debug(
        "LexGraph initialized (dialect={}, maxSections={}, mode={})",
        dialect.getName(),
        maxSections,
        startupParameters.mode());
  }

  /** Runs the pipeline for the configured document. */
  public void run() {
    if (configurationProvider == null) {
      throw new StateException("LexGraph.initialize() must be called before run()");
    }
    Path xmlPath = Path.of(startupParameters.getParameter("xml-path", String.class));
    boolean ingest = "ingest".equals(startupParameters.mode());
    if (!ingest) {
      for (String flag : new String[] {"clear", "dry-run", "demo"}) {
        if (startupParameters.isParameterPresent(flag)) {
          log.warn("--{} only applies to --mode ingest; ignored", flag);
        }
      }
    }

    this.tree = parser.parse(xmlPath);
    this.extraction = extractor.extractAll(tree);

    report.statistics(tree, extraction);
    if (startupParameters.isParameterPresent("show-hierarchy")) {
      int depth = startupParameters.getOptionalInt("max-depth").orElse(DEFAULT_HIERARCHY_DEPTH);
      report.hierarchy(tree, extraction, depth);
    }
    startupParameters
        .getOptionalParameter("show-section", String.class)
        .ifPresent(
            number ->
                tree.findSection(number)
                    .ifPresentOrElse(
                        s -> report.sectionDetails(tree, s, extraction),
                        () -> report.sectionNotFound(number)));
    startupParameters
        .getOptionalParameter("output", String.class)
        .ifPresent(
            output -> {
              exporter.export(tree, extraction, Path.of(output));
              report.exported(output);
            });
    report.sampleSections(tree, extraction, SAMPLE_SECTIONS);

    if (ingest) {
      this.projection = projector.project(tree, extraction);
      report.projection(projection);
      if (startupParameters.isParameterPresent("dry-run")) {
        log.info("Dry run: graph store not contacted");
      } else {
        load();
      }
    }
    report.warnings(extraction, projection);
  }

  private void load() {
    Configuration cfg = configuration();
    BatchLoaderProvider provider = BatchLoaderFactory.resolve(cfg);
    int batchSize =
        ConfigurationProvider.resolvedInt(
            cfg, "loader.batchSize", GraphIngestionService.DEFAULT_BATCH_SIZE);
    try (BatchLoader loader = provider.create(cfg)) {
      GraphIngestionService ingestion = new GraphIngestionService(loader, batchSize);
      this.ingestionStats =
          ingestion.ingest(projection, startupParameters.isParameterPresent("clear"));
      report.ingestion(ingestionStats, extraction);
      if (startupParameters.isParameterPresent("demo")) {
        runDemo(provider.createQueryDriver(cfg, loader));
      }
    }
  }

  /**
   * Three read-only queries: the first section with its context, the units referring to the most
   * referenced unit, and the first subsection.
   */
  private void runDemo(GraphQueryDriver queries) {
    queries.initialize();
    report.demoHeader();

    Optional<StructuralUnit> firstSection = tree.sections().stream().findFirst();
    String sectionCitation = firstSection.map(StructuralUnit::getCitation).orElse(null);
    report.demoSection(
        1,
        "First section (" + sectionCitation + ") with context",
        sectionCitation == null ? null : queries.sectionWithContext(sectionCitation));

    String mostReferenced = mostReferenced().orElse(sectionCitation);
    if (mostReferenced != null) {
      report.demoReferencing(2, mostReferenced, queries.referencingUnits(mostReferenced));
    }

    Optional<StructuralUnit> subsection =
        tree.units().stream()
            .filter(u -> u.getKind() == UnitKind.SUBSECTION && u.getCitation() != null)
            .findFirst();
    String subsectionCitation = subsection.map(StructuralUnit::getCitation).orElse(null);
    report.demoSection(
        3,
        "Subsection " + subsectionCitation + " with full context",
        subsectionCitation == null ? null : queries.sectionWithContext(subsectionCitation));
  }

  private Optional<String> mostReferenced() {
    Map<String, Integer> counts = new HashMap<>();
    for (Reference ref : extraction.references()) {
      counts.merge(ref.targetCitation(), 1, Integer::sum);
    }
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Integer>comparingByValue()
                .reversed()
                .thenComparing(Map.Entry.comparingByKey()))
        .map(Map.Entry::getKey)
        .findFirst();
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Configuration not loaded; call initialize() first");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public UnitTree tree() {
    return tree;
  }

  public ExtractionResult extraction() {
    return extraction;
  }

  public GraphProjection projection() {
    return projection;
  }

  public IngestionStats ingestionStats() {
    return ingestionStats;
  }
}
