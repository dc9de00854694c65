// file: server/src/main/java/io/courselite/server/ServerConfig.java
package io.courselite.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:    HTTP API port
 *  - dataPath:    optional course file loaded at startup
 *  - interactive: run the advising console on stdin/stdout instead of the HTTP server
 */
public record ServerConfig(
        int httpPort,
        String dataPath,
        boolean interactive
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,   -p   <port>
     *   --data,        -d   <path>
     *   --interactive, -i
     *   --help,        -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String dataPath = null;
        boolean interactive = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data", "-d" -> {
                    ensureValue(args, i);
                    dataPath = args[++i];
                }

                case "--interactive", "-i" -> interactive = true;

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, dataPath, interactive);
    }

    public boolean hasDataPath() {
        return dataPath != null && !dataPath.isBlank();
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,   -p   HTTP port (default: 8080)
              --data,        -d   Course file to load at startup (optional)
              --interactive, -i   Run the advising menu on the console instead of HTTP
              --help,        -h   Show this help message
            """);
        System.exit(0);
    }
}
