package io.kartlink;

import io.kartlink.cli.KartLinkCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new KartLinkCommand()).execute(args);
        System.exit(code);
    }
}
