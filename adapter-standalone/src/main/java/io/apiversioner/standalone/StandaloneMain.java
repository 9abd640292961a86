package io.apiversioner.standalone;

import io.apiversioner.standalone.server.GatewayApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the standalone versioning gateway. Delegates to {@link GatewayApp#start(String[])};
 * any startup failure is logged and the process exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /** @param args command-line arguments, e.g. {@code --config api-versioner.yaml} */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            GatewayApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
