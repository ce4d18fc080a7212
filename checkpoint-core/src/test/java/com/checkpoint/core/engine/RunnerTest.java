package com.checkpoint.core.engine;

import com.checkpoint.core.model.Issue;
import com.checkpoint.core.workspace.Workspace;
import com.checkpoint.core.workspace.WorkspaceTracker;
import com.checkpoint.core.workspace.Workspaces;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Runner}.
 */
class RunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void run_oneFailingEngine_reportsFailureAndKeepsOtherFindings() {
        Runner runner = new Runner(
            List.of(failing("Broken", "cannot read root"), succeeding("Healthy", 2)),
            Workspaces::inMemory, null);

        assertThatThrownBy(() -> runner.run(AnalysisContext.background(), tempDir))
            .isInstanceOf(EngineFailureException.class)
            .hasMessageStartingWith("analysis engines encountered errors: ")
            .hasMessageContaining("engine Broken failed: cannot read root")
            .satisfies(e -> assertThat(((EngineFailureException) e).getFailures())
                .extracting(EngineFailure::engineName)
                .containsExactly("Broken"));

        assertThat(runner.getIssues())
            .hasSize(2)
            .allSatisfy(issue -> assertThat(issue.id()).startsWith("Healthy-"));
    }

    @Test
    void run_multipleFailures_areAggregated() {
        Runner runner = new Runner(
            List.of(failing("First", "one"), failing("Second", "two")),
            Workspaces::inMemory, null);

        assertThatThrownBy(() -> runner.run(AnalysisContext.background(), tempDir))
            .isInstanceOf(EngineFailureException.class)
            .hasMessageContaining("engine First failed: one")
            .hasMessageContaining("engine Second failed: two");
    }

    @Test
    void run_allEnginesSucceed_collectsEveryFinding() throws AnalysisException {
        Runner runner = new Runner(
            List.of(succeeding("A", 1), succeeding("B", 3), succeeding("C", 0)),
            Workspaces::inMemory, null);

        runner.run(AnalysisContext.background(), tempDir);

        assertThat(runner.getIssues()).hasSize(4);
    }

    @Test
    void run_enginesExecuteConcurrently() throws AnalysisException {
        CountDownLatch bothStarted = new CountDownLatch(2);
        AnalysisEngine waiting = engine("Waiting", (context, root, workspace) -> {
            bothStarted.countDown();
            if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                throw new AnalysisException("engines did not run concurrently");
            }
            return List.of(Issue.builder("Waiting-1").build());
        });
        AnalysisEngine other = engine("Other", (context, root, workspace) -> {
            bothStarted.countDown();
            return List.of(Issue.builder("Other-1").build());
        });

        new Runner(List.of(waiting, other), Workspaces::inMemory, null).run(AnalysisContext.background(), tempDir);

        assertThat(bothStarted.getCount()).isZero();
    }

    @Test
    void run_sharesOneWorkspaceAndDisposesIt() throws AnalysisException {
        List<Workspace> seen = new ArrayList<>();
        AnalysisEngine recorder = engine("Recorder", (context, root, workspace) -> {
            synchronized (seen) {
                seen.add(workspace);
            }
            workspace.writeFile("recorder/out.txt", new byte[] {1});
            return List.of();
        });
        List<Workspace> tracked = new ArrayList<>();
        WorkspaceTracker tracker = tracked::add;

        new Runner(List.of(recorder, recorder), () -> Workspaces.onDisk(tempDir), tracker)
            .run(AnalysisContext.background(), tempDir);

        assertThat(seen).hasSize(2);
        assertThat(seen.get(0)).isSameAs(seen.get(1));
        assertThat(tracked).containsExactly(seen.get(0));
        assertThat(seen.get(0).isDisposed()).isTrue();
        assertThat(seen.get(0).root().orElseThrow()).doesNotExist();
    }

    @Test
    void run_workspaceCreationFails_throwsAnalysisException() {
        Runner runner = new Runner(List.of(succeeding("A", 1)), () -> {
            throw new IOException("disk full");
        }, null);

        assertThatThrownBy(() -> runner.run(AnalysisContext.background(), tempDir))
            .isInstanceOf(AnalysisException.class)
            .isNotInstanceOf(EngineFailureException.class)
            .hasMessageContaining("failed to create workspace")
            .hasMessageContaining("disk full");
    }

    @Test
    void run_cancelledContext_reportsEngineFailure() {
        AnalysisContext context = AnalysisContext.background();
        context.cancel();
        AnalysisEngine polite = engine("Polite", (ctx, root, workspace) -> {
            ctx.throwIfDone();
            return List.of(Issue.builder("Polite-1").build());
        });

        Runner runner = new Runner(List.of(polite), Workspaces::inMemory, null);

        assertThatThrownBy(() -> runner.run(context, tempDir))
            .isInstanceOf(EngineFailureException.class)
            .satisfies(e -> assertThat(((EngineFailureException) e).getFailures().get(0).cause())
                .isInstanceOf(CancellationException.class));
        assertThat(runner.getIssues()).isEmpty();
    }

    @Test
    void getIssues_returnsImmutableSnapshot() throws AnalysisException {
        Runner runner = new Runner(List.of(succeeding("A", 2)), Workspaces::inMemory, null);
        runner.run(AnalysisContext.background(), tempDir);

        List<Issue> issues = runner.getIssues();

        assertThatThrownBy(() -> issues.add(Issue.builder("X").build()))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(runner.getIssues()).hasSize(2);
    }

    @Test
    void run_secondRun_startsWithEmptyCollector() throws AnalysisException {
        Runner runner = new Runner(List.of(succeeding("A", 2)), Workspaces::inMemory, null);

        runner.run(AnalysisContext.background(), tempDir);
        runner.run(AnalysisContext.background(), tempDir);

        assertThat(runner.getIssues()).hasSize(2);
    }

    private static AnalysisEngine failing(String name, String message) {
        return engine(name, (context, root, workspace) -> {
            throw new AnalysisException(message);
        });
    }

    private static AnalysisEngine succeeding(String name, int count) {
        return engine(name, (context, root, workspace) -> {
            List<Issue> issues = new ArrayList<>();
            for (int i = 1; i <= count; i++) {
                issues.add(Issue.builder(name + "-" + i).title("finding " + i).build());
            }
            return issues;
        });
    }

    private static AnalysisEngine engine(String name, EngineBody body) {
        return new AnalysisEngine() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<Issue> analyze(AnalysisContext context, Path rootPath, Workspace workspace)
                    throws AnalysisException {
                try {
                    return body.analyze(context, rootPath, workspace);
                } catch (AnalysisException | RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new AnalysisException(e.getMessage(), e);
                }
            }
        };
    }

    @FunctionalInterface
    private interface EngineBody {
        List<Issue> analyze(AnalysisContext context, Path rootPath, Workspace workspace) throws Exception;
    }
}
