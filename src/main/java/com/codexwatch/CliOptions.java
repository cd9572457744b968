package com.codexwatch;

/**
 * Parsed command line.
 *
 * @param dryRun null when neither {@code --dry-run} nor {@code --no-dry-run} was given
 */
record CliOptions(
        Boolean dryRun,
        String releaseTag,
        boolean sendReleaseToDiscord
) {

    static final String USAGE =
            "usage: codexwatch [--dry-run | --no-dry-run] [--release-tag TAG [--send-release-to-discord]]";

    /**
     * @throws IllegalArgumentException on unknown or conflicting arguments
     */
    static CliOptions parse(String[] args) {
        Boolean dryRun = null;
        String releaseTag = null;
        boolean send = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--dry-run":
                case "--no-dry-run":
                    boolean value = arg.equals("--dry-run");
                    if (dryRun != null && dryRun != value) {
                        throw new IllegalArgumentException("argument --no-dry-run: not allowed with argument --dry-run");
                    }
                    dryRun = value;
                    break;
                case "--release-tag":
                    if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                        throw new IllegalArgumentException("argument --release-tag: expected one argument");
                    }
                    releaseTag = args[++i];
                    break;
                case "--send-release-to-discord":
                    send = true;
                    break;
                default:
                    if (arg.startsWith("--release-tag=")) {
                        releaseTag = arg.substring("--release-tag=".length());
                        if (releaseTag.isBlank()) {
                            throw new IllegalArgumentException("argument --release-tag: expected one argument");
                        }
                        break;
                    }
                    throw new IllegalArgumentException("unrecognized argument: " + arg);
            }
        }

        if (send && releaseTag == null) {
            throw new IllegalArgumentException("--send-release-to-discord requires --release-tag");
        }
        return new CliOptions(dryRun, releaseTag, send);
    }
}
