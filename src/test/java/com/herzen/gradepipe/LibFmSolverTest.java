package com.herzen.gradepipe;

import com.herzen.gradepipe.solver.LibFmSolver;
import com.herzen.gradepipe.solver.SolverException;
import com.herzen.gradepipe.solver.SolverModels.DimensionResult;
import com.herzen.gradepipe.solver.SolverModels.ModelVariant;
import com.herzen.gradepipe.solver.SolverModels.SolverRequest;
import com.herzen.gradepipe.solver.SolverModels.SolverSettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "gradepipe.solver.executable=/opt/libfm/bin/libFM")
class LibFmSolverTest {
    @Autowired
    private LibFmSolver solver;

    @Test
    void buildsRegressionCommandWithBiasTerms() {
        SolverRequest request = new SolverRequest(Path.of("d/train.libfm"), Path.of("d/test.libfm"),
                new SolverSettings(100, 0.3, 5, 20), true);

        assertEquals(List.of("/opt/libfm/bin/libFM", "-task", "r", "-train", Path.of("d/train.libfm").toString(),
                "-test", Path.of("d/test.libfm").toString(), "-iter", "100", "-init_stdev", "0.3", "-dim", "1,1,7"),
                solver.command(request, 7));
    }

    @Test
    void disablesBiasTermsForUnbiasedVariants() {
        SolverRequest request = new SolverRequest(Path.of("a"), Path.of("b"), new SolverSettings(10, 0.1, 1, 1),
                ModelVariant.TIME_SVD.usesBias());
        assertEquals("0,0,3", solver.command(request, 3).get(12));
    }

    @Test
    void readsErrorsFromIterationLine() {
        DimensionResult result = LibFmSolver.parseErrors("#Iter= 99\tTrain=0.412345\tTest=0.912", 8);
        assertEquals(new DimensionResult(8, 0.412345, 0.912), result);
    }

    @Test
    void missingOrUnreadableOutputIsFatal() {
        assertThrows(SolverException.class, () -> LibFmSolver.parseErrors(null, 5));
        assertThrows(SolverException.class, () -> LibFmSolver.parseErrors("Loading train...", 5));
    }

    @Test
    void unknownExecutableFailsTheRun() {
        SolverRequest request = new SolverRequest(Path.of("a"), Path.of("b"), new SolverSettings(1, 0.1, 1, 1), false);
        assertThrows(SolverException.class, () -> solver.sweep(request));
    }

    @Test
    void validatesSettings() {
        assertThrows(IllegalArgumentException.class, () -> new SolverSettings(0, 0.3, 5, 20));
        assertThrows(IllegalArgumentException.class, () -> new SolverSettings(100, 0.0, 5, 20));
        assertThrows(IllegalArgumentException.class, () -> new SolverSettings(100, 0.3, 6, 5));
        assertEquals(ModelVariant.BIASED_BPTF, ModelVariant.fromName("BiasedBPTF"));
    }

    @Test
    void collectsLastIterationOfFinishedProcess() {
        FakeProcess process = new FakeProcess(new ByteArrayInputStream(
                "#Iter= 0\tTrain=0.9\tTest=1.1\n#Iter= 1\tTrain=0.5\tTest=0.8\n".getBytes(StandardCharsets.UTF_8)), 0);
        assertEquals(new DimensionResult(4, 0.5, 0.8), solver.collect(process, 4));
        assertFalse(process.destroyed);
    }

    @Test
    void nonZeroExitFailsTheRun() {
        FakeProcess process = new FakeProcess(new ByteArrayInputStream(new byte[0]), 3);
        SolverException e = assertThrows(SolverException.class, () -> solver.collect(process, 4));
        assertTrue(e.getMessage().contains("exit code=3"));
    }

    @Test
    void brokenOutputStreamDestroysTheProcess() {
        FakeProcess process = new FakeProcess(new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("pipe closed");
            }
        }, 0);
        assertThrows(SolverException.class, () -> solver.collect(process, 4));
        assertTrue(process.destroyed);
    }

    private static class FakeProcess extends Process {
        private final InputStream output;
        private final int exitCode;
        boolean destroyed;

        FakeProcess(InputStream output, int exitCode) {
            this.output = output;
            this.exitCode = exitCode;
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return output;
        }

        @Override
        public InputStream getErrorStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyed = true;
        }
    }
}
