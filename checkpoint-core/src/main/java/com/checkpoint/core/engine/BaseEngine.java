package com.checkpoint.core.engine;

import com.checkpoint.core.model.Issue;
import com.checkpoint.core.model.IssueCategory;
import com.checkpoint.core.model.Priority;
import com.checkpoint.core.model.Severity;
import com.checkpoint.core.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Engine composed of an ordered list of independent tasks.
 *
 * <p>A failing task does not abort the engine: the failure is converted into a
 * single {@code ENGINE-TASK-FAILURE} finding and the remaining tasks still run,
 * so every engine built on this class has at-least-partial-success semantics.
 * Cancellation is the exception: it stops the engine and propagates.</p>
 *
 * <p><b>Usage Example</b></p>
 * <pre>{@code
 * public class MarkerEngine extends BaseEngine {
 *     public MarkerEngine() {
 *         super("MarkerEngine");
 *         registerTask(this::checkTodos);
 *         registerTask(this::checkFixmes);
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class BaseEngine implements AnalysisEngine {

    public static final String TASK_FAILURE_ID = "ENGINE-TASK-FAILURE";

    /**
     * Logger instance for this engine.
     * Automatically initialized with the concrete engine class name.
     */
    protected final Logger log;

    private final String name;
    private final List<AnalysisTask> tasks = new ArrayList<>();

    public BaseEngine(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Appends a task. Tasks run in registration order.
     *
     * @param task task to add
     */
    public void registerTask(AnalysisTask task) {
        tasks.add(Objects.requireNonNull(task, "task must not be null"));
    }

    @Override
    public List<Issue> analyze(AnalysisContext context, Path rootPath, Workspace workspace) {
        List<Issue> allIssues = new ArrayList<>();
        for (AnalysisTask task : tasks) {
            context.throwIfDone();
            try {
                List<Issue> issues = task.run(context, rootPath, workspace);
                if (issues != null) {
                    allIssues.addAll(issues);
                }
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Task failed in {}: {}", name, e.getMessage());
                log.debug("Task failure details", e);
                allIssues.add(taskFailure(rootPath, e));
            }
        }
        return allIssues;
    }

    private Issue taskFailure(Path rootPath, Exception e) {
        return Issue.builder(TASK_FAILURE_ID)
            .category(IssueCategory.CODE_QUALITY)
            .severity(Severity.MEDIUM)
            .priority(Priority.P2)
            .title("Task failed in " + name)
            .description(e.getMessage() != null ? e.getMessage() : e.getClass().getName())
            .location(String.valueOf(rootPath))
            .suggestion("Check logs and environment settings.")
            .build();
    }
}
