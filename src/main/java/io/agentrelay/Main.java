package io.agentrelay;

import io.agentrelay.cli.AgentRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentRelayCommand()).execute(args);
        System.exit(code);
    }
}
