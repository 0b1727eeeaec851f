package io.lendflow.cli;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class LendFlowCommandTest {

    @Test
    void subcommandsShareOneDataRoot() throws Exception {
        Path root = Files.createTempDirectory("lendflow-test-cli-");
        try {
            String dir = root.toString();
            Assertions.assertEquals(0, run("--root", dir, "init"));
            Assertions.assertTrue(Files.exists(root.resolve("lendflow.db")));

            Assertions.assertEquals(0, run("--root", dir, "application", "--id", "app-7", "--create"));
            Assertions.assertEquals(0, run("--root", dir, "application", "--id", "app-7", "--to", "document_collection"));
            Assertions.assertEquals(1, run("--root", dir, "application", "--id", "app-7", "--to", "approved"));
            Assertions.assertEquals(1, run("--root", dir, "application", "--id", "app-missing"));

            Assertions.assertEquals(0, run("--root", dir, "audit-verify"));
            Assertions.assertEquals(0, run("--root", dir, "audit-counts"));
            Assertions.assertEquals(0, run("--root", dir, "errors", "--stats"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownStateIsReportedAsFailure() throws Exception {
        Path root = Files.createTempDirectory("lendflow-test-cli-");
        try {
            String dir = root.toString();
            run("--root", dir, "application", "--id", "app-8", "--create");
            Assertions.assertNotEquals(0, run("--root", dir, "application", "--id", "app-8", "--to", "teleported"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int run(String... args) {
        return new CommandLine(new LendFlowCommand()).execute(args);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            stream.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount()))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException ignored) {
                        }
                    });
        }
    }
}
