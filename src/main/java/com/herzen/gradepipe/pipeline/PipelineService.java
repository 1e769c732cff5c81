package com.herzen.gradepipe.pipeline;

import com.herzen.gradepipe.config.PipelineProperties;
import com.herzen.gradepipe.domain.DomainModels.PreprocessedRecord;
import com.herzen.gradepipe.domain.DomainModels.Split;
import com.herzen.gradepipe.encoding.EncodingModels.EncodedSplit;
import com.herzen.gradepipe.encoding.EncodingModels.OutputFormat;
import com.herzen.gradepipe.encoding.EncodingModels.TimeMode;
import com.herzen.gradepipe.encoding.MatrixEncoder;
import com.herzen.gradepipe.idmap.IdMapModels.IdMap;
import com.herzen.gradepipe.idmap.IdMapModels.IdMapKind;
import com.herzen.gradepipe.idmap.IdentifierMapper;
import com.herzen.gradepipe.parser.DelimitedTableParser;
import com.herzen.gradepipe.parser.DelimitedTableWriter;
import com.herzen.gradepipe.parser.ParserDtos.Table;
import com.herzen.gradepipe.pipeline.PipelineModels.*;
import com.herzen.gradepipe.preprocess.RecordPreprocessor;
import com.herzen.gradepipe.repository.LeaderboardJdbcRepository;
import com.herzen.gradepipe.results.ResultAggregator;
import com.herzen.gradepipe.results.ResultModels.MethodResult;
import com.herzen.gradepipe.results.ResultsFormatter;
import com.herzen.gradepipe.solver.FactorizationSolver;
import com.herzen.gradepipe.solver.SolverModels.DimensionResult;
import com.herzen.gradepipe.solver.SolverModels.ModelVariant;
import com.herzen.gradepipe.solver.SolverModels.SolverRequest;
import com.herzen.gradepipe.solver.SolverModels.SolverSettings;
import com.herzen.gradepipe.split.SplitModels.SplitConfig;
import com.herzen.gradepipe.split.TrainTestSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

@Service
public class PipelineService {
    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final PipelineProperties properties;
    private final DelimitedTableParser parser;
    private final DelimitedTableWriter writer;
    private final IdentifierMapper identifierMapper;
    private final RecordPreprocessor preprocessor;
    private final TrainTestSplitter splitter;
    private final MatrixEncoder encoder;
    private final FactorizationSolver solver;
    private final ResultAggregator aggregator;
    private final ResultsFormatter formatter;
    private final LeaderboardJdbcRepository leaderboards;
    private final ArtifactNaming naming;

    public PipelineService(PipelineProperties properties,
                           DelimitedTableParser parser,
                           DelimitedTableWriter writer,
                           IdentifierMapper identifierMapper,
                           RecordPreprocessor preprocessor,
                           TrainTestSplitter splitter,
                           MatrixEncoder encoder,
                           FactorizationSolver solver,
                           ResultAggregator aggregator,
                           ResultsFormatter formatter,
                           LeaderboardJdbcRepository leaderboards,
                           ArtifactNaming naming) {
        this.properties = properties;
        this.parser = parser;
        this.writer = writer;
        this.identifierMapper = identifierMapper;
        this.preprocessor = preprocessor;
        this.splitter = splitter;
        this.encoder = encoder;
        this.solver = solver;
        this.aggregator = aggregator;
        this.formatter = formatter;
        this.leaderboards = leaderboards;
        this.naming = naming;
    }

    public Workspace defaultWorkspace() {
        return new Workspace(properties.dataPath(), properties.outcomesPath());
    }

    public SplitConfig splitConfig(String filters, Boolean discardNongrade, Integer backfillColdStudents, Integer backfillColdCourses) {
        PipelineProperties.Split defaults = properties.split();
        return SplitConfig.of(
                filters == null || filters.isBlank() ? defaults.filters() : filters,
                defaults.termMax(),
                discardNongrade == null ? defaults.discardNongrade() : discardNongrade,
                backfillColdStudents == null ? defaults.backfillColdStudents() : backfillColdStudents,
                backfillColdCourses == null ? defaults.backfillColdCourses() : backfillColdCourses);
    }

    public SolverSettings solverSettings(Integer iterations, Double initStdev, Integer dimStart, Integer dimEnd) {
        PipelineProperties.Solver defaults = properties.solver();
        return new SolverSettings(
                iterations == null ? defaults.iterations() : iterations,
                initStdev == null ? defaults.initStdev() : initStdev,
                dimStart == null ? defaults.dimStart() : dimStart,
                dimEnd == null ? defaults.dimEnd() : dimEnd);
    }

    public PreparedData prepare(Workspace ws, boolean force) {
        Map<IdMapKind, Path> idMapFiles = new EnumMap<>(IdMapKind.class);
        for (IdMapKind kind : IdMapKind.values()) idMapFiles.put(kind, ws.dataDir().resolve(kind.fileName()));
        Path preprocessedFile = ws.dataDir().resolve(ArtifactNaming.PREPROCESSED_FILE);

        List<Path> outputs = new ArrayList<>(idMapFiles.values());
        outputs.add(preprocessedFile);
        if (!force && allExist(outputs)) {
            log.info("Preprocessed data already present in {}, skipping", ws.dataDir());
            return new PreparedData(idMapFiles, preprocessedFile, preprocessor.read(preprocessedFile).size(), true);
        }

        Table courses = parser.read(ws.dataDir().resolve(properties.inputs().coursesFile()), ',');
        Table admissions = parser.read(ws.dataDir().resolve(properties.inputs().admissionsFile()), ',');

        Map<IdMapKind, IdMap> idMaps = identifierMapper.buildAll(courses);
        idMaps.forEach((kind, map) -> identifierMapper.write(map, idMapFiles.get(kind)));

        List<PreprocessedRecord> records = preprocessor.preprocess(courses, admissions, idMaps);
        preprocessor.write(records, preprocessedFile);
        log.info("Wrote {} preprocessed records to {}", records.size(), preprocessedFile);
        return new PreparedData(idMapFiles, preprocessedFile, records.size(), false);
    }

    public SplitArtifacts split(Workspace ws, SplitConfig config, OutputFormat format, TimeMode time, boolean force) {
        Path train = naming.splitFile(ws.dataDir(), config, format, time, "train");
        Path test = naming.splitFile(ws.dataDir(), config, format, time, "test");
        if (!force && allExist(List.of(train, test))) {
            log.info("Split artifacts {} already present, skipping", train.getFileName());
            return new SplitArtifacts(train, test, countLines(train), countLines(test), true);
        }

        PreparedData prepared = prepare(ws, false);
        Split split = splitter.split(preprocessor.read(prepared.preprocessedFile()), config);

        if (format == OutputFormat.TRIPLES) {
            writer.writeLines(train, encoder.triples(split.train()));
            writer.writeLines(test, encoder.triples(split.test()));
        } else {
            EncodedSplit encoded = encoder.features(split, time);
            writer.writeLines(train, encoded.train());
            writer.writeLines(test, encoded.test());
            log.debug("Feature space for {}: columns from {}, time from {}", train.getFileName(),
                    encoded.space().columnOffset(), encoded.space().timeIndex());
        }
        log.info("Wrote split {} ({} train / {} test)", train.getFileName(), split.train().size(), split.test().size());
        return new SplitArtifacts(train, test, split.train().size(), split.test().size(), false);
    }

    public VariantRun runVariant(Workspace ws, SplitConfig config, ModelVariant variant, SolverSettings settings, boolean force) {
        Path resultFile = naming.methodResultFile(ws.outcomesDir(), config, variant, settings);
        if (!force && Files.exists(resultFile)) {
            log.info("{} results already present at {}, skipping", variant.methodName(), resultFile);
            return new VariantRun(variant, resultFile, aggregator.readMethodResults(resultFile), true);
        }

        SplitArtifacts artifacts = split(ws, config, OutputFormat.FEATURES, variant.timeMode(), false);
        List<DimensionResult> results = solver.sweep(new SolverRequest(artifacts.train(), artifacts.test(), settings, variant.usesBias()));
        aggregator.writeMethodResults(resultFile, results);
        log.info("{}: {} dimensions evaluated, results in {}", variant.methodName(), results.size(), resultFile);
        return new VariantRun(variant, resultFile, results, false);
    }

    public Comparison compare(Workspace ws, SplitConfig config, SolverSettings settings, int topN, int precision, boolean force) {
        String splitKey = naming.splitKey(config, settings);
        Path leaderboardFile = naming.leaderboardFile(ws.outcomesDir(), config, settings, topN);
        Path tableFile = naming.tableFile(leaderboardFile);

        List<MethodResult> ranked;
        if (!force && Files.exists(leaderboardFile)) {
            log.info("Leaderboard {} already present, skipping solver runs", leaderboardFile.getFileName());
            ranked = aggregator.readLeaderboard(leaderboardFile);
        } else {
            Map<String, List<DimensionResult>> byMethod = new LinkedHashMap<>();
            for (ModelVariant variant : ModelVariant.values()) {
                byMethod.put(variant.methodName(), runVariant(ws, config, variant, settings, false).results());
            }
            ranked = aggregator.aggregate(byMethod, topN);
            aggregator.writeLeaderboard(leaderboardFile, ranked);
        }

        String table = formatter.format(ranked, precision, properties.results().margin());
        writer.writeLines(tableFile, List.of(table));
        leaderboards.replace(splitKey, topN, ranked);
        log.info("Comparison {} ranked {} results", splitKey, ranked.size());
        return new Comparison(splitKey, topN, leaderboardFile, tableFile, ranked, table);
    }

    public List<Comparison> runAll(Workspace ws, SolverSettings settings, boolean force) {
        PipelineProperties.Results results = properties.results();
        return results.runAllSplits().stream()
                .map(filters -> compare(ws, splitConfig(filters, null, null, null), settings, results.topN(), results.precision(), force))
                .toList();
    }

    public List<MethodResult> storedLeaderboard(SplitConfig config, SolverSettings settings, int topN) {
        return leaderboards.load(naming.splitKey(config, settings), topN);
    }

    public String storedTable(SplitConfig config, SolverSettings settings, int topN, int precision) {
        return formatter.format(storedLeaderboard(config, settings, topN), precision, properties.results().margin());
    }

    private static boolean allExist(Collection<Path> files) {
        return files.stream().allMatch(Files::exists);
    }

    private static int countLines(Path file) {
        try (var lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return (int) lines.filter(l -> !l.isBlank()).count();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }
}
