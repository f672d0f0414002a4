package io.kartlink.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.kartlink.testing.TestFiles;
import io.kartlink.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class KartLinkCommandTest {
    private Path root;
    private PrintStream originalOut;
    private ByteArrayOutputStream captured;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("kartlink-test-cli-");
        originalOut = System.out;
        captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() throws Exception {
        System.setOut(originalOut);
        TestFiles.deleteRecursively(root);
    }

    private int run(String... args) {
        captured.reset();
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new KartLinkCommand()).execute(full);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    private JsonNode json() throws Exception {
        return Jsons.mapper().readTree(output());
    }

    @Test
    void initCreatesTheDatabase() {
        Assertions.assertEquals(0, run("init"));
        Assertions.assertTrue(output().contains("Initialized KartLink at:"));
        Assertions.assertTrue(Files.exists(root.resolve("kartlink.db")));
    }

    @Test
    void recordedValueShowsUpAsPendingAndLatest() throws Exception {
        Assertions.assertEquals(0, run("record", "--component-type", "2", "--component-id", "1",
                "--command", "0", "--value", "4100"));
        Assertions.assertEquals(1L, json().get("id").asLong());

        Assertions.assertEquals(0, run("pending", "--limit", "10"));
        JsonNode pending = json();
        Assertions.assertEquals(1, pending.size());
        Assertions.assertEquals(4100L, pending.get(0).get("value").asLong());
        Assertions.assertFalse(pending.get(0).get("uploaded").asBoolean());

        Assertions.assertEquals(0, run("latest", "2", "1"));
        Assertions.assertEquals(4100L, json().get("value").asLong());

        Assertions.assertEquals(0, run("stats"));
        JsonNode stats = json();
        Assertions.assertEquals("vehicle", stats.get("role").asText());
        Assertions.assertEquals(1L, stats.get("store").get("pendingRecords").asLong());

        Assertions.assertEquals(0, run("history", "--component-type", "2"));
        Assertions.assertEquals(1L, json().get("total").asLong());
    }

    @Test
    void latestWithoutRecordsFails() {
        Assertions.assertEquals(1, run("latest", "4", "9"));
        Assertions.assertTrue(output().contains("no record for component"));
    }

    @Test
    void settingsReflectRoleOverride() throws Exception {
        Assertions.assertEquals(0, run("--role", "remote", "settings"));
        JsonNode settings = json();
        Assertions.assertEquals("REMOTE", settings.get("role").asText());
        Assertions.assertEquals(50, settings.get("batchSize").asInt());
    }

    @Test
    void metricsAndMigrationsAreListed() throws Exception {
        Assertions.assertEquals(0, run("metrics"));
        Assertions.assertTrue(output().contains("# TYPE kartlink_records gauge"));

        Assertions.assertEquals(0, run("schema-migrations"));
        Assertions.assertEquals(2, json().size());
    }
}
