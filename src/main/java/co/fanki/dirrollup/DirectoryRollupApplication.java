package co.fanki.dirrollup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Directory Rollup Application.
 *
 * <p>Rolls flat per-file metric records up the implied directory tree of
 * a repository, reporting direct and recursive stats per directory, a
 * repository summary with distribution and inequality measures, and
 * COCOMO cost estimates.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class DirectoryRollupApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(DirectoryRollupApplication.class, args);
    }

}
