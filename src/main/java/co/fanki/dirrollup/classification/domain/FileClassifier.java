package co.fanki.dirrollup.classification.domain;

import co.fanki.dirrollup.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies repository files by path, name and extension.
 *
 * <p>Rules are evaluated in a fixed precedence and the first match wins:
 * CI, build, test, config, docs. The order is part of the contract: a
 * workflow under {@code .github/workflows/} is {@code ci} even though
 * its {@code .yml} extension is also a config rule.</p>
 *
 * <p>Immutable and thread-safe once constructed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FileClassifier {

    private final List<String> ciDirectories;
    private final List<String> ciFileNames;
    private final List<String> buildFileNames;
    private final List<String> buildExtensions;
    private final List<String> testDirectories;
    private final List<Pattern> testPatterns;
    private final List<String> configFileNames;
    private final List<Pattern> configPatterns;
    private final List<String> configExtensions;
    private final List<String> docDirectories;
    private final List<String> docExtensions;

    /**
     * Creates a classifier for the given rules.
     *
     * @param rules the rule set, never null
     */
    public FileClassifier(final ClassificationRules rules) {
        Preconditions.requireNonNull(rules, "Classification rules are required");
        this.ciDirectories = lower(rules.ciDirectories());
        this.ciFileNames = lower(rules.ciFileNames());
        this.buildFileNames = lower(rules.buildFileNames());
        this.buildExtensions = lower(rules.buildExtensions());
        this.testDirectories = lower(rules.testDirectories());
        this.testPatterns = globs(rules.testFilePatterns());
        this.configFileNames = lower(rules.configFileNames());
        this.configPatterns = globs(rules.configFilePatterns());
        this.configExtensions = lower(rules.configExtensions());
        this.docDirectories = lower(rules.docDirectories());
        this.docExtensions = lower(rules.docExtensions());
    }

    /**
     * Creates a classifier with {@link ClassificationRules#standard()}.
     *
     * @return the classifier
     */
    public static FileClassifier standard() {
        return new FileClassifier(ClassificationRules.standard());
    }

    /**
     * Classifies a file.
     *
     * @param path the repository-relative path of the file
     * @param filename the file name, last segment of the path
     * @param extension the extension with its dot, empty if none
     * @return the classification, empty for source files
     */
    public Optional<FileClassification> classify(final String path,
            final String filename, final String extension) {
        Preconditions.requireNonNull(path, "Path is required");
        Preconditions.requireNonNull(filename, "File name is required");
        Preconditions.requireNonNull(extension, "Extension is required");

        final String segmentedPath = "/" + path.toLowerCase(Locale.ROOT);
        final String name = filename.toLowerCase(Locale.ROOT);
        final String ext = extension.toLowerCase(Locale.ROOT);

        if (inDirectory(segmentedPath, ciDirectories)
                || ciFileNames.contains(name)) {
            return Optional.of(FileClassification.CI);
        }
        if (buildFileNames.contains(name) || buildExtensions.contains(ext)) {
            return Optional.of(FileClassification.BUILD);
        }
        if (matchesAny(filename, testPatterns)
                || inDirectory(segmentedPath, testDirectories)) {
            return Optional.of(FileClassification.TEST);
        }
        if (configFileNames.contains(name)
                || matchesAny(filename, configPatterns)
                || configExtensions.contains(ext)) {
            return Optional.of(FileClassification.CONFIG);
        }
        if (inDirectory(segmentedPath, docDirectories)
                || docExtensions.contains(ext)) {
            return Optional.of(FileClassification.DOCS);
        }
        return Optional.empty();
    }

    /**
     * Classifies a file by its path alone, deriving name and extension.
     *
     * @param path the repository-relative path
     * @return the classification, SOURCE when no rule matched
     */
    public FileClassification categorize(final String path) {
        Preconditions.requireNonNull(path, "Path is required");
        final String filename = path.substring(path.lastIndexOf('/') + 1);
        final int dot = filename.lastIndexOf('.');
        final String extension = dot > 0 ? filename.substring(dot) : "";
        return classify(path, filename, extension)
                .orElse(FileClassification.SOURCE);
    }

    private static boolean inDirectory(final String segmentedPath,
            final List<String> directories) {
        for (final String directory : directories) {
            if (segmentedPath.contains("/" + directory)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAny(final String filename,
            final List<Pattern> patterns) {
        for (final Pattern pattern : patterns) {
            if (pattern.matcher(filename).matches()) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lower(final List<String> values) {
        final List<String> result = new ArrayList<>(values.size());
        for (final String value : values) {
            result.add(value.toLowerCase(Locale.ROOT));
        }
        return List.copyOf(result);
    }

    private static List<Pattern> globs(final List<String> patterns) {
        final List<Pattern> result = new ArrayList<>(patterns.size());
        for (final String glob : patterns) {
            final boolean caseSensitive = !glob.equals(
                    glob.toLowerCase(Locale.ROOT));
            final Pattern pattern = caseSensitive
                    ? Pattern.compile(toRegex(glob))
                    : Pattern.compile(toRegex(glob),
                            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            result.add(pattern);
        }
        return List.copyOf(result);
    }

    private static String toRegex(final String glob) {
        final StringBuilder regex = new StringBuilder();
        final StringBuilder literal = new StringBuilder();
        for (final char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }

}
