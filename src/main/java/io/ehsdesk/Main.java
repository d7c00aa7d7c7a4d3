package io.ehsdesk;

import io.ehsdesk.cli.EhsDeskCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new EhsDeskCommand()).execute(args);
        System.exit(code);
    }
}
