package io.seatwatch;

import io.seatwatch.cli.SeatWatchCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = SeatWatchCommand.commandLine().execute(args);
        System.exit(code);
    }
}
