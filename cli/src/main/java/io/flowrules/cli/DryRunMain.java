package io.flowrules.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code flow-rules-dry-run}. Delegates to
 * {@link DryRunCommand} and exits with its status code; an unexpected failure
 * is logged and exits with status 1.
 */
public final class DryRunMain {

    private static final Logger LOG = LoggerFactory.getLogger(DryRunMain.class);

    private DryRunMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new DryRunCommand(System.out, System.err, System::getenv).run(args);
        } catch (Exception e) {
            LOG.error("Dry run failed: {}", e.getMessage(), e);
            status = DryRunCommand.EXIT_STARTUP;
        }
        System.exit(status);
    }
}
