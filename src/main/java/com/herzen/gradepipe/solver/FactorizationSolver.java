package com.herzen.gradepipe.solver;

import com.herzen.gradepipe.solver.SolverModels.DimensionResult;
import com.herzen.gradepipe.solver.SolverModels.SolverRequest;

import java.util.List;

public interface FactorizationSolver {
    List<DimensionResult> sweep(SolverRequest request);
}
