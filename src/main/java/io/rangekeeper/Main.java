package io.rangekeeper;

import io.rangekeeper.cli.RangeKeeperCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RangeKeeperCommand()).execute(args);
        System.exit(code);
    }
}
