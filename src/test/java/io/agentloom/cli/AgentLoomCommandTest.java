package io.agentloom.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentloom.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class AgentLoomCommandTest {

    @Test
    void initCreatesDataLayout() throws Exception {
        Path root = Files.createTempDirectory("agentloom-cli-");
        try {
            int code = execute(root, "init");

            Assertions.assertEquals(0, code);
            Assertions.assertTrue(Files.exists(root.resolve("agentloom.db")));
            Assertions.assertTrue(Files.isDirectory(root.resolve("projects")));
            Assertions.assertTrue(Files.isDirectory(root.resolve("workers")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runThenShowAndListProject() throws Exception {
        Path root = Files.createTempDirectory("agentloom-cli-");
        try {
            Assertions.assertEquals(0, execute(root, "run", "--project", "demo", "--iterations", "2", "--interval-ms", "0"));
            Assertions.assertEquals(0, execute(root, "phase", "demo", "testing"));

            String shown = captureStdout(() -> execute(root, "show", "demo"));
            JsonNode state = Jsons.mapper().readTree(shown);
            Assertions.assertEquals("testing", state.path("phase").asText());
            Assertions.assertEquals("hello", state.path("livingDocuments").path("greeting").path("text").asText());

            String listed = captureStdout(() -> execute(root, "projects"));
            JsonNode projects = Jsons.mapper().readTree(listed);
            Assertions.assertEquals(1, projects.size());
            Assertions.assertEquals("Untitled Project", projects.get(0).path("name").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingProjectExitsNonZero() throws Exception {
        Path root = Files.createTempDirectory("agentloom-cli-");
        try {
            Assertions.assertEquals(1, execute(root, "show", "nope"));
            Assertions.assertEquals(1, execute(root, "phase", "nope", "design"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emitNeedsBroker() throws Exception {
        Path root = Files.createTempDirectory("agentloom-cli-");
        try {
            int code = execute(root, "emit", "user_idea_submitted", "--payload", "{\"idea\":\"todo\"}");
            Assertions.assertEquals(2, code);
        } finally {
            deleteRecursively(root);
        }
    }

    private static int execute(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return AgentLoomCommand.newCommandLine().execute(full);
    }

    private static String captureStdout(Runnable action) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            action.run();
        } finally {
            System.setOut(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
