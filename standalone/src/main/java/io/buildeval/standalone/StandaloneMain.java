package io.buildeval.standalone;

import io.buildeval.standalone.cli.EvaluateCommand;
import io.buildeval.standalone.cli.LogbackConfigurator;
import io.buildeval.standalone.config.CliConfig;
import io.buildeval.standalone.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the command line: loads the configuration, evaluates the
 * project and prints the result as JSON on standard output. On failure, logs
 * the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g.
     *     {@code --project app.proj -p:Configuration=Release})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            CliConfig config = ConfigLoader.load(args);
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            new EvaluateCommand(config, System.getenv()).run(System.out);
        } catch (Exception e) {
            LOG.error("Evaluation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
