package com.herzen.gradepipe.api;

import com.herzen.gradepipe.config.PipelineProperties;
import com.herzen.gradepipe.encoding.EncodingModels.OutputFormat;
import com.herzen.gradepipe.encoding.EncodingModels.TimeMode;
import com.herzen.gradepipe.pipeline.PipelineModels;
import com.herzen.gradepipe.pipeline.PipelineService;
import com.herzen.gradepipe.results.ResultModels.MethodResult;
import com.herzen.gradepipe.solver.SolverModels.ModelVariant;
import com.herzen.gradepipe.solver.SolverModels.SolverSettings;
import com.herzen.gradepipe.split.SplitModels.SplitConfig;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {
    private final PipelineService pipelineService;
    private final PipelineProperties properties;

    public PipelineController(PipelineService pipelineService, PipelineProperties properties) {
        this.pipelineService = pipelineService;
        this.properties = properties;
    }

    @PostMapping("/prepare")
    public ResponseEntity<PipelineModels.PreparedData> prepare(@RequestParam(defaultValue = "false") boolean force) {
        return ResponseEntity.ok(pipelineService.prepare(pipelineService.defaultWorkspace(), force));
    }

    @PostMapping("/splits")
    public ResponseEntity<PipelineModels.SplitArtifacts> split(@RequestBody SplitRequest request) {
        return ResponseEntity.ok(pipelineService.split(pipelineService.defaultWorkspace(), splitConfig(request),
                OutputFormat.fromName(request.format()), TimeMode.fromCode(request.time()), request.force()));
    }

    @PostMapping("/variants/{variant}/run")
    public ResponseEntity<PipelineModels.VariantRun> runVariant(@PathVariable String variant, @RequestBody RunRequest request) {
        return ResponseEntity.ok(pipelineService.runVariant(pipelineService.defaultWorkspace(), splitConfig(request.split()),
                ModelVariant.fromName(variant), solverSettings(request), request.force()));
    }

    @PostMapping("/compare")
    public ResponseEntity<PipelineModels.Comparison> compare(@RequestBody RunRequest request) {
        return ResponseEntity.ok(pipelineService.compare(pipelineService.defaultWorkspace(), splitConfig(request.split()),
                solverSettings(request), topN(request.topN()), precision(request.precision()), request.force()));
    }

    @PostMapping("/run-all")
    public ResponseEntity<List<PipelineModels.Comparison>> runAll(@RequestParam(defaultValue = "false") boolean force) {
        return ResponseEntity.ok(pipelineService.runAll(pipelineService.defaultWorkspace(),
                pipelineService.solverSettings(null, null, null, null), force));
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<MethodResult>> leaderboard(@RequestParam(required = false) String split,
                                                          @RequestParam(required = false) Integer topN) {
        return ResponseEntity.ok(pipelineService.storedLeaderboard(
                pipelineService.splitConfig(split, null, null, null),
                pipelineService.solverSettings(null, null, null, null),
                topN(topN)));
    }

    @GetMapping(value = "/leaderboard/table", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> leaderboardTable(@RequestParam(required = false) String split,
                                                   @RequestParam(required = false) Integer topN,
                                                   @RequestParam(required = false) Integer precision) {
        return ResponseEntity.ok(pipelineService.storedTable(
                pipelineService.splitConfig(split, null, null, null),
                pipelineService.solverSettings(null, null, null, null),
                topN(topN), precision(precision)));
    }

    private SplitConfig splitConfig(SplitRequest request) {
        if (request == null) return pipelineService.splitConfig(null, null, null, null);
        return pipelineService.splitConfig(request.filters(), request.discardNongrade(),
                request.backfillColdStudents(), request.backfillColdCourses());
    }

    private SolverSettings solverSettings(RunRequest request) {
        return pipelineService.solverSettings(request.iterations(), request.initStdev(), request.dimStart(), request.dimEnd());
    }

    private int topN(Integer requested) {
        return requested == null ? properties.results().topN() : requested;
    }

    private int precision(Integer requested) {
        return requested == null ? properties.results().precision() : requested;
    }

    public record SplitRequest(String filters,
                               Boolean discardNongrade,
                               Integer backfillColdStudents,
                               Integer backfillColdCourses,
                               String format,
                               String time,
                               boolean force) {}

    public record RunRequest(SplitRequest split,
                             Integer iterations,
                             Double initStdev,
                             Integer dimStart,
                             Integer dimEnd,
                             Integer topN,
                             Integer precision,
                             boolean force) {}
}
