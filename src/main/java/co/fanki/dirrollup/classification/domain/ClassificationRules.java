package co.fanki.dirrollup.classification.domain;

import co.fanki.dirrollup.shared.Preconditions;
import co.fanki.dirrollup.shared.ValueObject;

import java.util.List;

/**
 * The rule set a {@link FileClassifier} applies.
 *
 * <p>Directory rules end with a slash and match any path segment
 * sequence, e.g. {@code tests/} matches {@code tests/a.py} and
 * {@code pkg/tests/a.py} but not {@code latests/a.py}. Name rules match
 * the whole file name. Pattern rules are globs over the file name
 * ({@code *} and {@code ?}); a pattern that contains an uppercase letter
 * is matched case-sensitively so that {@code *Test.*} does not catch
 * {@code latest.py}, every other rule ignores case. Extensions include
 * the leading dot.</p>
 *
 * @param ciDirectories directories holding CI pipelines
 * @param ciFileNames CI pipeline file names
 * @param buildFileNames build script file names
 * @param buildExtensions build project extensions
 * @param testDirectories test directories
 * @param testFilePatterns test file name globs
 * @param configFileNames configuration file names
 * @param configFilePatterns configuration file name globs
 * @param configExtensions configuration extensions
 * @param docDirectories documentation directories
 * @param docExtensions documentation extensions
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ClassificationRules(
        List<String> ciDirectories,
        List<String> ciFileNames,
        List<String> buildFileNames,
        List<String> buildExtensions,
        List<String> testDirectories,
        List<String> testFilePatterns,
        List<String> configFileNames,
        List<String> configFilePatterns,
        List<String> configExtensions,
        List<String> docDirectories,
        List<String> docExtensions) implements ValueObject {

    /** Creates the rule set, copying every list. */
    public ClassificationRules {
        ciDirectories = copy(ciDirectories, "CI directories");
        ciFileNames = copy(ciFileNames, "CI file names");
        buildFileNames = copy(buildFileNames, "Build file names");
        buildExtensions = copy(buildExtensions, "Build extensions");
        testDirectories = copy(testDirectories, "Test directories");
        testFilePatterns = copy(testFilePatterns, "Test file patterns");
        configFileNames = copy(configFileNames, "Config file names");
        configFilePatterns = copy(configFilePatterns, "Config patterns");
        configExtensions = copy(configExtensions, "Config extensions");
        docDirectories = copy(docDirectories, "Doc directories");
        docExtensions = copy(docExtensions, "Doc extensions");
    }

    /**
     * Returns the rules used across the scanner adapters.
     *
     * @return the standard rule set
     */
    public static ClassificationRules standard() {
        return new ClassificationRules(
                List.of(".github/", ".circleci/"),
                List.of("Jenkinsfile", ".gitlab-ci.yml", ".gitlab-ci.yaml",
                        "azure-pipelines.yml", "azure-pipelines.yaml",
                        ".travis.yml", "appveyor.yml",
                        "bitbucket-pipelines.yml"),
                List.of("Makefile", "CMakeLists.txt", "pom.xml",
                        "build.gradle", "build.gradle.kts", "gulpfile.js",
                        "Gruntfile.js", "Rakefile", "justfile"),
                List.of(".csproj", ".fsproj", ".vbproj", ".sln", ".gradle"),
                List.of("tests/", "__tests__/", "test/", "spec/", "testing/"),
                List.of("test_*", "*_test.*", "*.test.*", "*.spec.*",
                        "*Test.*", "*Tests.*"),
                List.of("package.json", "tsconfig.json", "pyproject.toml",
                        "setup.py", "setup.cfg", "requirements.txt",
                        "Cargo.toml", "go.mod", "go.sum"),
                List.of("*.config.*", ".env*", "*.conf", "settings.*"),
                List.of(".yaml", ".yml", ".toml", ".ini", ".cfg"),
                List.of("docs/", "doc/", "documentation/"),
                List.of(".md", ".rst", ".adoc", ".asciidoc", ".txt"));
    }

    private static List<String> copy(final List<String> values,
            final String name) {
        Preconditions.requireNonNull(values, name + " are required");
        return List.copyOf(values);
    }

}
