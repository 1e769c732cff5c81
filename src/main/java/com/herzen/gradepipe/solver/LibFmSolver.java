package com.herzen.gradepipe.solver;

import com.herzen.gradepipe.config.PipelineProperties;
import com.herzen.gradepipe.solver.SolverModels.DimensionResult;
import com.herzen.gradepipe.solver.SolverModels.SolverRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class LibFmSolver implements FactorizationSolver {
    private static final Logger log = LoggerFactory.getLogger(LibFmSolver.class);
    private static final Pattern ERROR_LINE = Pattern.compile("Train=([-+0-9.eE]+)\\s+Test=([-+0-9.eE]+)");

    private final String executable;

    public LibFmSolver(PipelineProperties properties) {
        this.executable = properties.solver().executable();
    }

    @Override
    public List<DimensionResult> sweep(SolverRequest request) {
        List<DimensionResult> results = new ArrayList<>();
        for (int dim = request.settings().dimStart(); dim <= request.settings().dimEnd(); dim++) {
            results.add(run(request, dim));
        }
        return results;
    }

    public List<String> command(SolverRequest request, int dim) {
        String bias = request.useBias() ? "1" : "0";
        return List.of(
                executable,
                "-task", "r",
                "-train", request.train().toString(),
                "-test", request.test().toString(),
                "-iter", Integer.toString(request.settings().iterations()),
                "-init_stdev", Double.toString(request.settings().initStdev()),
                "-dim", bias + "," + bias + "," + dim);
    }

    private DimensionResult run(SolverRequest request, int dim) {
        List<String> command = command(request, dim);
        log.info("Running solver for dim={}: {}", dim, String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        try {
            return collect(pb.start(), dim);
        } catch (IOException e) {
            throw new SolverException("Cannot run solver '" + executable + "'", e);
        }
    }

    public DimensionResult collect(Process process, int dim) {
        String lastErrors = null;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (ERROR_LINE.matcher(line).find()) lastErrors = line;
            }
        } catch (IOException e) {
            process.destroy();
            throw new SolverException("Cannot read solver output for dim=" + dim, e);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new SolverException("Interrupted while waiting for solver, dim=" + dim, e);
        }
        if (exitCode != 0) {
            throw new SolverException("Solver failed (exit code=" + exitCode + ") for dim=" + dim);
        }
        return parseErrors(lastErrors, dim);
    }

    public static DimensionResult parseErrors(String line, int dim) {
        if (line == null) throw new SolverException("Solver produced no Train=/Test= line for dim=" + dim);
        Matcher m = ERROR_LINE.matcher(line);
        if (!m.find()) throw new SolverException("Unreadable solver output for dim=" + dim + ": " + line);
        return new DimensionResult(dim, Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)));
    }
}
