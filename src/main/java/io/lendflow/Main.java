package io.lendflow;

import io.lendflow.cli.LendFlowCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LendFlowCommand()).execute(args);
        System.exit(code);
    }
}
