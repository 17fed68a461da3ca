package io.buildeval.core.evaluation;

import io.buildeval.core.cache.ProjectRootElementCache;
import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.construction.ImportElement;
import io.buildeval.core.construction.ProjectRootElement;
import io.buildeval.core.error.CircularImportException;
import io.buildeval.core.error.ImportNotFoundException;
import io.buildeval.core.error.InvalidProjectFileException;
import io.buildeval.core.error.SdkResolutionException;
import io.buildeval.core.sdk.SdkReference;
import io.buildeval.core.sdk.SdkResolverService;
import io.buildeval.core.spi.EvaluationListener.ImportIgnoredEvent;
import io.buildeval.core.spi.EvaluationListener.ImportIgnoredReason;
import io.buildeval.core.spi.EvaluationListener.ImportResolvedEvent;
import io.buildeval.core.spi.SdkResolverContext;
import io.buildeval.core.spi.SdkResult;
import io.buildeval.core.toolset.ProjectImportSearchPaths;
import io.buildeval.core.toolset.Toolset;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@code <Import>} elements to parsed files for one evaluation.
 *
 * <p>
 * Keeps the two import views of the evaluation: the first resolution of every
 * distinct file, and every traversal including duplicates (the latter only
 * differs from the former under
 * {@link LoadSetting#RECORD_DUPLICATE_BUT_NOT_CIRCULAR_IMPORTS}). Files that
 * would close a cycle with a file currently being evaluated are never recorded.
 *
 * <p>
 * Not thread-safe; owned by a single evaluation.
 */
final class ImportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ImportResolver.class);

    static final String DUPLICATE_IMPORT_CODE = "MSB4011";
    static final String IMPORT_NOT_FOUND_CODE = "MSB4019";
    static final String EMPTY_IMPORT_CODE = "MSB4020";
    static final String INVALID_IMPORT_CODE = "MSB4024";
    static final String CIRCULAR_IMPORT_CODE = "MSB4210";
    static final String FALLBACK_NOT_FOUND_CODE = "MSB4226";
    static final String SDK_NOT_FOUND_CODE = "MSB4236";

    /** The evaluation state the resolver needs. */
    interface Host {

        /** Expands property references; the result stays escaped. */
        String expandProperties(String expression, ElementLocation location);

        boolean evaluateCondition(String condition, Path directory, ElementLocation location);

        /** Re-evaluates a condition to describe it; never throws. */
        Optional<Boolean> evaluateConditionForLogging(String condition, Path directory, ElementLocation location);

        /**
         * Expands a condition to describe it; returns {@code null} when
         * expansion fails.
         */
        String expandForLogging(String condition, ElementLocation location);

        /** Current escaped value of a property, or {@code null}. */
        String propertyValueEscaped(String name);

        /**
         * {@code true} when {@code file} is the main project or an import
         * currently being evaluated.
         */
        boolean isBeingEvaluated(Path file);
    }

    private record LoadResult(ImportOutcome outcome, List<ResolvedImport> imported) {}

    private final ProjectRootElement mainProject;
    private final Toolset toolset;
    private final ProjectRootElementCache cache;
    private final SdkResolverService sdkResolver;
    private final EvaluationSettings settings;
    private final ListenerNotifier notifier;
    private final Host host;
    private final Map<Path, ResolvedImport> importsSeen = new LinkedHashMap<>();
    private final List<ResolvedImport> imports = new ArrayList<>();
    private final List<ResolvedImport> importsIncludingDuplicates = new ArrayList<>();

    ImportResolver(
            ProjectRootElement mainProject,
            Toolset toolset,
            ProjectRootElementCache cache,
            SdkResolverService sdkResolver,
            EvaluationSettings settings,
            ListenerNotifier notifier,
            Host host) {
        this.mainProject = mainProject;
        this.toolset = toolset;
        this.cache = cache;
        this.sdkResolver = sdkResolver;
        this.settings = settings;
        this.notifier = notifier;
        this.host = host;
    }

    /** First resolution of each distinct file, in resolution order. */
    List<ResolvedImport> imports() {
        return Collections.unmodifiableList(imports);
    }

    List<ResolvedImport> importsIncludingDuplicates() {
        return Collections.unmodifiableList(importsIncludingDuplicates);
    }

    /**
     * Resolves one import.
     *
     * @return the files whose content must now be evaluated, in order
     * @throws ImportNotFoundException when a file is missing and missing
     *     imports are not ignored
     * @throws CircularImportException when a cycle is found and circular
     *     imports are rejected
     * @throws SdkResolutionException when an SDK cannot be resolved and missing
     *     imports are not ignored
     */
    List<ResolvedImport> resolve(ImportElement element) {
        Path importingDirectory = element.containingProject().directory();
        if (element.isSdkImport()) {
            return resolveSdkImport(element, importingDirectory);
        }
        Optional<ProjectImportSearchPaths> fallback = searchPathsReferencedBy(element.project());
        if (fallback.isPresent()) {
            return resolveWithFallbackSearchPaths(element, importingDirectory, fallback.get());
        }
        if (!host.evaluateCondition(element.condition(), importingDirectory, element.location())) {
            falseCondition(element, element.condition(), importingDirectory);
            return List.of();
        }
        return load(element, importingDirectory, element.project(), null, null, true).imported();
    }

    // --- SDK imports ---

    private List<ResolvedImport> resolveSdkImport(ImportElement element, Path importingDirectory) {
        if (!host.evaluateCondition(element.condition(), importingDirectory, element.location())) {
            falseCondition(element, element.condition(), importingDirectory);
            return List.of();
        }
        SdkReference sdk = new SdkReference(
                element.sdk().trim(), blankToNull(element.version()), blankToNull(element.minimumVersion()));
        SdkResolverContext context = new SdkResolverContext(
                mainProject.fullPath(), element.containingProject().fullPath(), toolset.toolsVersion(), false);
        SdkResult result = sdkResolver.resolve(sdk, context, element.location());
        for (String warning : result.warnings()) {
            notifier.warning(null, warning, element.location());
        }
        if (!result.isSuccess()) {
            String message = "Could not resolve SDK \"" + sdk + "\". " + String.join(" ", result.errors());
            if (settings.has(LoadSetting.IGNORE_MISSING_IMPORTS)) {
                LOG.info("SDK not resolved, import skipped: sdk={}, importedBy={}", sdk, element.location());
                ignored(element, null, ImportIgnoredReason.SDK_NOT_RESOLVED);
                return List.of();
            }
            throw new SdkResolutionException(message, SDK_NOT_FOUND_CODE, element.location());
        }
        LOG.debug("SDK resolved: sdk={}, path={}, version={}", sdk, result.path(), result.version());
        return load(element, result.path(), element.project(), sdk, result, true).imported();
    }

    // --- Fallback search paths ---

    private Optional<ProjectImportSearchPaths> searchPathsReferencedBy(String project) {
        if (project.indexOf("$(") < 0) {
            return Optional.empty();
        }
        for (ProjectImportSearchPaths paths : toolset.searchPaths(Toolset.currentOs())) {
            if (!paths.searchPaths().isEmpty() && indexOfReference(project, paths.propertyName()) >= 0) {
                return Optional.of(paths);
            }
        }
        return Optional.empty();
    }

    private List<ResolvedImport> resolveWithFallbackSearchPaths(
            ImportElement element, Path importingDirectory, ProjectImportSearchPaths fallback) {
        String property = fallback.propertyName();
        List<String> candidates = new ArrayList<>();
        String current = host.propertyValueEscaped(property);
        candidates.add(current != null ? EscapingUtilities.unescape(current) : null);
        candidates.addAll(fallback.searchPaths());
        LOG.debug("Search paths for $({}): {}", property, candidates);

        boolean wildcards = FileMatcher.hasWildcards(element.project());
        boolean exactFileMissing = false;
        List<String> expandedDirectories = new ArrayList<>();
        List<ResolvedImport> union = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty()) {
                continue;
            }
            String directory = EscapingUtilities.unescape(host.expandProperties(candidate, element.location()));
            // an undefined property expands to nothing and matches no directory
            if (directory.isEmpty()) {
                continue;
            }
            expandedDirectories.add(directory);
            if (!isDirectory(importingDirectory, directory)) {
                continue;
            }
            String condition = replaceReference(element.condition(), property, directory);
            if (!host.evaluateCondition(condition, importingDirectory, element.location())) {
                falseCondition(element, condition, importingDirectory);
                continue;
            }
            String project = replaceReference(element.project(), property, directory);
            LOG.debug("Trying import search path: project={}, searchPath={}", project, directory);
            LoadResult result = load(element, importingDirectory, project, null, null, false);
            if (result.outcome() == ImportOutcome.PROJECTS_IMPORTED
                    || result.outcome() == ImportOutcome.FOUND_FILES_TO_IMPORT_BUT_IGNORED) {
                if (!wildcards) {
                    return result.imported();
                }
                union.addAll(result.imported());
            } else if (result.outcome() == ImportOutcome.TRIED_TO_IMPORT_BUT_FILE_NOT_FOUND) {
                exactFileMissing = true;
            }
        }
        if (union.isEmpty() && exactFileMissing && !settings.has(LoadSetting.IGNORE_MISSING_IMPORTS)) {
            throw new ImportNotFoundException(
                    "The imported project \"" + element.project() + "\" was not found. Also tried to find it in the"
                            + " fallback search path(s) for $(" + property + ") - " + expandedDirectories
                            + ". Confirm that the path in the <Import> declaration is correct, and that the file exists"
                            + " on disk in one of the search paths.",
                    FALLBACK_NOT_FOUND_CODE,
                    element.location());
        }
        return union;
    }

    private static boolean isDirectory(Path base, String directory) {
        try {
            return Files.isDirectory(base.resolve(directory));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private static int indexOfReference(String text, String property) {
        Matcher m = referencePattern(property).matcher(text);
        return m.find() ? m.start() : -1;
    }

    private static String replaceReference(String text, String property, String replacement) {
        return referencePattern(property).matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }

    private static Pattern referencePattern(String property) {
        return Pattern.compile("\\$\\(\\s*" + Pattern.quote(property) + "\\s*\\)", Pattern.CASE_INSENSITIVE);
    }

    // --- Loading ---

    /**
     * Expands {@code project}, which may list several expressions and
     * wildcards, and loads every file it names.
     *
     * @param throwOnFileNotFound {@code false} when a missing file only marks
     *     the outcome, as for fallback search path candidates
     */
    private LoadResult load(
            ImportElement element,
            Path directory,
            String project,
            SdkReference sdk,
            SdkResult sdkResult,
            boolean throwOnFileNotFound) {
        String expanded = host.expandProperties(project, element.location());
        List<String> expressions = ExpressionShredder.splitSemiColonSeparatedList(expanded);
        if (expressions.isEmpty()) {
            if (!settings.has(LoadSetting.IGNORE_EMPTY_IMPORTS)) {
                throw new InvalidProjectFileException(
                        "The value \"\" of the \"Project\" attribute in element <Import> is invalid. Expanded from \""
                                + element.project() + "\".",
                        EMPTY_IMPORT_CODE,
                        element.location());
            }
            ignored(element, null, ImportIgnoredReason.EMPTY_EXPRESSION);
            return new LoadResult(ImportOutcome.IMPORT_EXPRESSION_RESOLVED_TO_NOTHING, List.of());
        }

        List<ResolvedImport> imported = new ArrayList<>();
        boolean foundButIgnored = false;
        boolean fileNotFound = false;
        for (String expression : expressions) {
            for (Path file : files(directory, EscapingUtilities.unescape(expression), element)) {
                if (host.isBeingEvaluated(file)) {
                    circular(element, file);
                    foundButIgnored = true;
                    continue;
                }
                ResolvedImport previous = importsSeen.get(file);
                if (previous != null) {
                    duplicate(element, file, previous, sdk, sdkResult);
                    foundButIgnored = true;
                    continue;
                }
                Optional<ProjectRootElement> root = loadFile(element, file, throwOnFileNotFound);
                if (root.isEmpty()) {
                    fileNotFound = fileNotFound || !Files.exists(file);
                    continue;
                }
                ResolvedImport resolved = new ResolvedImport(
                        element, root.get(), element.containingProject() != mainProject, sdk, sdkResult);
                importsSeen.put(file, resolved);
                imports.add(resolved);
                importsIncludingDuplicates.add(resolved);
                imported.add(resolved);
                LOG.debug("Import resolved: file={}, importedBy={}", file, element.location());
                if (settings.logImports()) {
                    notifier.notify("onImportResolved", l -> l.onImportResolved(
                            new ImportResolvedEvent(element.location(), element.project(), file.toString())));
                }
            }
        }
        ImportOutcome outcome;
        if (!imported.isEmpty()) {
            outcome = ImportOutcome.PROJECTS_IMPORTED;
        } else if (foundButIgnored) {
            outcome = ImportOutcome.FOUND_FILES_TO_IMPORT_BUT_IGNORED;
        } else if (fileNotFound) {
            outcome = ImportOutcome.TRIED_TO_IMPORT_BUT_FILE_NOT_FOUND;
        } else {
            outcome = ImportOutcome.IMPORT_EXPRESSION_RESOLVED_TO_NOTHING;
        }
        return new LoadResult(outcome, imported);
    }

    /** Expands one unescaped expression into normalized absolute paths. */
    private static List<Path> files(Path directory, String expression, ImportElement element) {
        try {
            if (!FileMatcher.hasWildcards(expression)) {
                return List.of(directory.resolve(expression.replace('\\', '/')).normalize());
            }
            List<Path> result = new ArrayList<>();
            for (FileMatcher.Match match : FileMatcher.match(directory, expression)) {
                result.add(directory.resolve(match.path()).normalize());
            }
            return result;
        } catch (InvalidPathException | UncheckedIOException e) {
            throw new InvalidProjectFileException(
                    "The value \"" + expression + "\" of the \"Project\" attribute in element <Import> is invalid. "
                            + e.getMessage(),
                    e,
                    EMPTY_IMPORT_CODE,
                    element.location());
        }
    }

    private Optional<ProjectRootElement> loadFile(ImportElement element, Path file, boolean throwOnFileNotFound) {
        if (cache.tryGet(file).isEmpty() && !Files.isRegularFile(file)) {
            if (throwOnFileNotFound && !settings.has(LoadSetting.IGNORE_MISSING_IMPORTS)) {
                throw new ImportNotFoundException(
                        "The imported project \"" + file + "\" was not found. Confirm that the expression in the"
                                + " Import declaration \"" + element.project() + "\" is correct, and that the file"
                                + " exists on disk.",
                        IMPORT_NOT_FOUND_CODE,
                        element.location());
            }
            LOG.info("Import not found, skipped: file={}, importedBy={}", file, element.location());
            ignored(element, file, ImportIgnoredReason.FILE_NOT_FOUND);
            return Optional.empty();
        }
        try {
            return Optional.of(cache.get(file, false));
        } catch (InvalidProjectFileException e) {
            if (settings.has(LoadSetting.IGNORE_INVALID_IMPORTS)) {
                LOG.warn("Invalid import skipped: file={}, error={}", file, e.getMessage());
                return Optional.empty();
            }
            throw new InvalidProjectFileException(
                    "The imported project file \"" + file + "\" could not be loaded. " + e.getMessage(),
                    e,
                    INVALID_IMPORT_CODE,
                    element.location());
        }
    }

    private void circular(ImportElement element, Path file) {
        String message = "There is a circular dependency involving the import of \"" + file + "\" by \""
                + element.containingProject().fullPath() + "\". This import has been ignored.";
        if (settings.has(LoadSetting.REJECT_CIRCULAR_IMPORTS)) {
            throw new CircularImportException(message, CIRCULAR_IMPORT_CODE, element.location());
        }
        notifier.warning(CIRCULAR_IMPORT_CODE, message, element.location());
        ignored(element, file, ImportIgnoredReason.CIRCULAR);
    }

    private void duplicate(
            ImportElement element, Path file, ResolvedImport previous, SdkReference sdk, SdkResult sdkResult) {
        notifier.warning(
                DUPLICATE_IMPORT_CODE,
                "Cannot import \"" + file + "\" into \"" + element.containingProject().fullPath()
                        + "\" again. It was previously imported at " + previous.importingElement().location()
                        + ". This is most likely a build authoring error. This subsequent import will be ignored.",
                element.location());
        if (settings.has(LoadSetting.RECORD_DUPLICATE_BUT_NOT_CIRCULAR_IMPORTS)) {
            importsIncludingDuplicates.add(new ResolvedImport(
                    element, previous.importedProject(), element.containingProject() != mainProject, sdk, sdkResult));
        }
        ignored(element, file, ImportIgnoredReason.DUPLICATE);
    }

    // --- Events ---

    private void falseCondition(ImportElement element, String condition, Path directory) {
        LOG.debug("Import condition false: project={}, condition={}", element.project(), condition);
        if (!settings.logImports()) {
            return;
        }
        String expanded = host.expandForLogging(condition, element.location());
        LOG.info("Import skipped, condition false: project={}, condition={}, expanded={}, reevaluated={}",
                element.project(),
                condition,
                expanded,
                host.evaluateConditionForLogging(condition, directory, element.location())
                        .map(String::valueOf)
                        .orElse("unknown"));
        notifier.notify("onImportIgnored", l -> l.onImportIgnored(new ImportIgnoredEvent(
                element.location(),
                element.project(),
                null,
                ImportIgnoredReason.FALSE_CONDITION,
                condition,
                expanded)));
    }

    private void ignored(ImportElement element, Path file, ImportIgnoredReason reason) {
        notifier.notify("onImportIgnored", l -> l.onImportIgnored(new ImportIgnoredEvent(
                element.location(),
                element.project(),
                file != null ? file.toString() : null,
                reason,
                element.condition(),
                null)));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
