package io.trellis.server;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.jboss.logging.Logger;

/// Process entry point: serves the meta-tools over stdin/stdout.
///
/// Every live session is closed on exit, whether input ends, the agent
/// sends `shutdown`, or the JVM is asked to stop.
public final class TrellisMain {

    private static final Logger LOG = Logger.getLogger(TrellisMain.class);

    private TrellisMain() {}

    public static void main(String[] args) throws IOException {
        // stdout carries protocol messages only
        PrintStream protocolOut = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.setOut(System.err);

        TrellisEnvironment env = TrellisFactory.createEnvironment();
        Runtime.getRuntime()
                .addShutdownHook(new Thread(env::close, "trellis-shutdown"));

        try (BufferedReader in =
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            env.getServer().serve(in, protocolOut);
        } finally {
            env.close();
            LOG.info("Trellis stopped");
        }
    }
}
