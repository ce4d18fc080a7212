package com.checkpoint.core.flags;

import com.checkpoint.core.engine.AnalysisContext;
import com.checkpoint.core.engine.AnalysisEngine;
import com.checkpoint.core.engine.AnalysisException;
import com.checkpoint.core.model.ConflictSeverity;
import com.checkpoint.core.model.ConflictType;
import com.checkpoint.core.model.FlagConflict;
import com.checkpoint.core.model.FlagStatus;
import com.checkpoint.core.model.ImplementationStatus;
import com.checkpoint.core.model.Issue;
import com.checkpoint.core.source.CallShape;
import com.checkpoint.core.source.MemberReference;
import com.checkpoint.core.source.SourceModel;
import com.checkpoint.core.source.SourceModelProvider;
import com.checkpoint.core.source.SourceTree;
import com.checkpoint.core.util.PathUtils;
import com.checkpoint.core.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Audits a program's command-line flags against its implementation, help text
 * and documentation.
 *
 * <p>Reconciliation runs five phases, each consuming and returning the
 * accumulating flag list:
 * <ol>
 *   <li>{@link #catalogFlags} finds flag registrations in the configuration package</li>
 *   <li>{@link #classifyImplementation} traces configuration field usage</li>
 *   <li>{@link #crossReference} matches flags against user and planning documents</li>
 *   <li>{@link #detectConflicts} records disagreements between sources</li>
 *   <li>{@link #validateFunctionality} checks the rendered help text</li>
 * </ol>
 * Only cataloging failures are fatal for {@link #analyze}; a failure in any later
 * phase is logged and the flags from the previous phase are carried forward.</p>
 *
 * <p>{@link #detectConflicts} appends to the conflict lists of the flags it is
 * given, so it must be called at most once per flag list.</p>
 *
 * @since 1.0.0
 */
public class FlagReconciliationEngine implements AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(FlagReconciliationEngine.class);

    public static final String NAME = "FlagSystem";
    public static final String PRESENT_IN_HELP = "Present in help output";
    public static final String MISSING_FROM_HELP = "Not found in help output";

    static final String FLAG_STATUS_REPORT = "flag-system/flag_status.md";

    private static final String FLAG_MARKER = "--";
    private static final String CHANGED_CALL = "changed";
    private static final Pattern FLAG_TOKEN = Pattern.compile("--([a-z][a-z0-9-]+)");

    private final FlagAuditSettings settings;
    private final SourceModelProvider sourceModels;
    private final HelpTextRenderer helpText;
    private final FieldNameMapper fieldNames;
    private final FlagRegistrationParser registrations;
    private volatile List<FlagStatus> lastFlags = List.of();

    public FlagReconciliationEngine(FlagAuditSettings settings,
                                    SourceModelProvider sourceModels,
                                    HelpTextRenderer helpText) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.sourceModels = Objects.requireNonNull(sourceModels, "sourceModels must not be null");
        this.helpText = Objects.requireNonNull(helpText, "helpText must not be null");
        this.fieldNames = new FieldNameMapper(settings.fieldOverrides());
        this.registrations = new FlagRegistrationParser(settings.registrationSuffixes(), settings.shortFormMarker());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Issue> analyze(AnalysisContext context, Path rootPath, Workspace workspace) throws AnalysisException {
        List<FlagStatus> flags = reconcile(context, rootPath);
        lastFlags = List.copyOf(flags);
        writeStatusReport(workspace, flags);
        return new FlagIssueReporter(reportLocation(rootPath)).report(flags);
    }

    /**
     * Returns the flags reconciled by the most recent completed {@link #analyze} call.
     *
     * @return reconciled flags, empty if no analysis has completed
     */
    public List<FlagStatus> lastFlags() {
        return lastFlags;
    }

    /**
     * Runs all five phases. Only a cataloging failure is propagated.
     *
     * @param context cancellation context
     * @param rootPath project root
     * @return reconciled flags, declared flags first followed by ghost flags
     * @throws AnalysisException if the flags cannot be cataloged
     */
    public List<FlagStatus> reconcile(AnalysisContext context, Path rootPath) throws AnalysisException {
        List<FlagStatus> flags = catalogFlags(context, rootPath);
        log.debug("Cataloged {} flags under {}", flags.size(), rootPath);

        try {
            flags = classifyImplementation(context, rootPath, flags);
        } catch (AnalysisException e) {
            log.warn("{}", e.getMessage());
        }
        try {
            flags = crossReference(context, rootPath, flags);
        } catch (AnalysisException e) {
            log.warn("{}", e.getMessage());
        }
        flags = detectConflicts(context, flags);
        try {
            flags = validateFunctionality(context, flags);
        } catch (AnalysisException e) {
            log.warn("{}", e.getMessage());
        }
        return flags;
    }

    /**
     * Phase 1: finds every flag registration in the configuration package.
     *
     * @param context cancellation context
     * @param rootPath project root
     * @return one entry per registration, in source order
     * @throws AnalysisException if the configuration package is missing or unreadable
     */
    public List<FlagStatus> catalogFlags(AnalysisContext context, Path rootPath) throws AnalysisException {
        List<FlagStatus> flags = new ArrayList<>();
        try {
            for (SourceModel model : loadConfigSources(rootPath)) {
                context.throwIfDone();
                for (CallShape call : model.calls()) {
                    registrations.parse(call).ifPresent(flags::add);
                }
            }
        } catch (IOException e) {
            throw new AnalysisException("cataloging flags: " + e.getMessage(), e);
        }
        return flags;
    }

    /**
     * Phase 2: classifies each flag by where its configuration field is referenced.
     *
     * @param context cancellation context
     * @param rootPath project root
     * @param flags cataloged flags
     * @return the same list, updated in place
     * @throws AnalysisException if the configuration package is missing or unreadable
     */
    public List<FlagStatus> classifyImplementation(AnalysisContext context, Path rootPath, List<FlagStatus> flags)
            throws AnalysisException {
        List<SourceModel> configSources;
        Optional<SourceModel> mainSource;
        try {
            configSources = loadConfigSources(rootPath);
            mainSource = loadMainSource(rootPath);
        } catch (IOException e) {
            throw new AnalysisException("classifying flags: " + e.getMessage(), e);
        }

        String configText = configSources.stream().map(SourceModel::text).reduce("", String::concat);
        for (FlagStatus flag : flags) {
            context.throwIfDone();
            String fieldName = fieldNames.fieldNameFor(flag.getLongForm());

            boolean usedInConfig = configSources.stream()
                .anyMatch(model -> referencesField(model, fieldName) || checksChanged(model, flag.getLongForm()));
            boolean usedInMain = mainSource.map(model -> referencesField(model, fieldName)).orElse(false);

            if (usedInConfig && usedInMain) {
                flag.setStatus(ImplementationStatus.FULLY_IMPLEMENTED);
            } else if (usedInConfig || usedInMain) {
                flag.setStatus(ImplementationStatus.PARTIALLY_IMPLEMENTED);
            } else {
                flag.setStatus(ImplementationStatus.PLANNED_NOT_IMPLEMENTED);
            }

            if (configText.contains(FLAG_MARKER + flag.getLongForm())) {
                flag.setDefinedInHelp(true);
            }
        }
        return flags;
    }

    /**
     * Phase 3: matches flags against user and planning documents and appends
     * ghost flags found only in planning text.
     *
     * @param context cancellation context
     * @param rootPath project root
     * @param flags classified flags
     * @return a new list with the given flags followed by ghost flags
     * @throws AnalysisException if an existing document cannot be read
     */
    public List<FlagStatus> crossReference(AnalysisContext context, Path rootPath, List<FlagStatus> flags)
            throws AnalysisException {
        String userDocs;
        String planningDocs;
        try {
            userDocs = readCombined(rootPath, settings.userDocs());
            planningDocs = readCombined(rootPath, settings.planningDocs());
        } catch (IOException e) {
            throw new AnalysisException("cross-referencing flags: " + e.getMessage(), e);
        }

        for (FlagStatus flag : flags) {
            context.throwIfDone();
            String token = FLAG_MARKER + flag.getLongForm();
            if (userDocs.contains(token)) {
                flag.setDefinedInDocs(true);
            }
            if (planningDocs.contains(token)) {
                flag.setDefinedInPlanning(true);
            }
        }

        List<FlagStatus> result = new ArrayList<>(flags);
        Set<String> known = new HashSet<>();
        flags.forEach(flag -> known.add(flag.getLongForm()));
        for (String candidate : extractFlagTokens(planningDocs)) {
            if (known.add(candidate)) {
                log.debug("Ghost flag --{} found in planning documents", candidate);
                result.add(FlagStatus.ghost(candidate));
            }
        }
        return result;
    }

    /**
     * Phase 4: records conflicts between sources. Orphaned and description
     * conflicts are mutually exclusive; planning mismatches are independent.
     *
     * @param context cancellation context
     * @param flags cross-referenced flags
     * @return the same list, with conflicts appended
     */
    public List<FlagStatus> detectConflicts(AnalysisContext context, List<FlagStatus> flags) {
        for (FlagStatus flag : flags) {
            context.throwIfDone();
            if (flag.isDefinedInCode() && !flag.isDefinedInHelp() && !flag.isDefinedInDocs()) {
                flag.addConflict(new FlagConflict(ConflictType.ORPHANED_FLAG, "code", "documentation",
                    "Flag is implemented in code but missing from help text and user documentation.",
                    ConflictSeverity.HIGH));
            }
            if (flag.isDefinedInCode() && !flag.isDefinedInDocs() && !flag.hasConflict(ConflictType.ORPHANED_FLAG)) {
                flag.addConflict(new FlagConflict(ConflictType.DESCRIPTION_CONFLICT, "code", "user_docs",
                    "Flag is implemented but missing from user-facing markdown documentation.",
                    ConflictSeverity.MEDIUM));
            }
            if (flag.isDefinedInPlanning() && !flag.isDefinedInCode()) {
                flag.addConflict(new FlagConflict(ConflictType.PLANNING_MISMATCH, "planning", "code",
                    "Flag mentioned in planning documents but not implemented in code.",
                    ConflictSeverity.HIGH));
            }
        }
        return flags;
    }

    /**
     * Phase 5: checks each flag's presence in the rendered help text. Flags
     * classified as not implemented are skipped.
     *
     * @param context cancellation context
     * @param flags flags to validate
     * @return the same list, updated in place
     * @throws AnalysisException if the help text cannot be rendered
     */
    public List<FlagStatus> validateFunctionality(AnalysisContext context, List<FlagStatus> flags)
            throws AnalysisException {
        String help;
        try {
            help = helpText.render();
        } catch (Exception e) {
            throw new AnalysisException("validating flags: " + e.getMessage(), e);
        }
        if (help == null) {
            help = "";
        }

        for (FlagStatus flag : flags) {
            context.throwIfDone();
            if (flag.getStatus() == ImplementationStatus.PLANNED_NOT_IMPLEMENTED) {
                continue;
            }
            boolean present = help.contains(FLAG_MARKER + flag.getLongForm());
            flag.setActualBehavior(present ? PRESENT_IN_HELP : MISSING_FROM_HELP);
            flag.setTestCoverage(present);
        }
        return flags;
    }

    /**
     * Extracts the distinct flag-shaped tokens of a text, in order of first appearance.
     *
     * @param text text to scan
     * @return long forms without the marker
     */
    static List<String> extractFlagTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        Matcher matcher = FLAG_TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group(1));
        }
        return new ArrayList<>(tokens);
    }

    private boolean referencesField(SourceModel model, String fieldName) {
        Collection<String> receivers = settings.receivers();
        for (MemberReference ref : model.memberReferences()) {
            if (receivers.contains(ref.receiver()) && matchesField(ref.member(), fieldName)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesField(String member, String fieldName) {
        return member.equalsIgnoreCase(fieldName)
            || member.equals("get" + fieldName)
            || member.equals("is" + fieldName);
    }

    private static boolean checksChanged(SourceModel model, String longForm) {
        return model.calls().stream()
            .filter(call -> CHANGED_CALL.equals(call.name()))
            .anyMatch(call -> call.literalArgument(0).map(longForm::equals).orElse(false));
    }

    private List<SourceModel> loadConfigSources(Path rootPath) throws IOException {
        Path packageDir = findConfigPackage(rootPath);
        List<SourceModel> models = new ArrayList<>();
        for (Path file : SourceTree.listSourceFiles(packageDir)) {
            Optional<SourceModel> model = sourceModels.load(file);
            if (model.isPresent()) {
                models.add(model.get());
            } else {
                log.debug("Skipping unparsable configuration source: {}", file);
            }
        }
        return models;
    }

    private Optional<SourceModel> loadMainSource(Path rootPath) throws IOException {
        Path mainPath = rootPath.resolve(settings.mainSource());
        if (!Files.isRegularFile(mainPath)) {
            log.debug("Main source not found: {}", mainPath);
            return Optional.empty();
        }
        return sourceModels.load(mainPath);
    }

    private Path findConfigPackage(Path rootPath) throws IOException {
        return SourceTree.findPackageDirectory(rootPath, settings.configPackage())
            .orElseThrow(() -> new IOException(
                "package '" + settings.configPackage() + "' not found under " + rootPath));
    }

    private String reportLocation(Path rootPath) {
        try {
            return SourceTree.findPackageDirectory(rootPath, settings.configPackage())
                .map(Path::toString)
                .orElse(rootPath.toString());
        } catch (IOException e) {
            log.debug("Falling back to project root as finding location: {}", e.getMessage());
            return rootPath.toString();
        }
    }

    private static String readCombined(Path rootPath, List<String> relativePaths) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String relative : relativePaths) {
            Path file = rootPath.resolve(relative);
            if (!Files.exists(file)) {
                continue;
            }
            sb.append(PathUtils.readString(file)).append('\n');
        }
        return sb.toString();
    }

    private static void writeStatusReport(Workspace workspace, List<FlagStatus> flags) {
        try {
            workspace.writeFile(FLAG_STATUS_REPORT, FlagStatusReport.render(flags).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to write flag status report: {}", e.getMessage());
        }
    }
}
