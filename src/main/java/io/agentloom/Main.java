package io.agentloom;

import io.agentloom.cli.AgentLoomCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = AgentLoomCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
