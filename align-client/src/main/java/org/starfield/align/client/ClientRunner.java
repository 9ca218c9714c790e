package org.starfield.align.client;

import org.starfield.alignment.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions and overall process completion events.
 * Absence of the standard exit log message indicates that the client was terminated abnormally.
 */
public abstract class ClientRunner {

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with status 0 on success or 1 on any failure.
     */
    public void run() {
        System.exit(runWithoutExit());
    }

    /**
     * Wraps a run with consistent log statements.
     *
     * @return process exit status (0 on success, 1 on failure).
     */
    public int runWithoutExit() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int status;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
            status = 0;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            status = 1;
        }

        return status;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
