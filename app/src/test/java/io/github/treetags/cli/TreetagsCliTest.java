package io.github.treetags.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.github.treetags.TagGenerator;
import io.github.treetags.config.ExtrasConfig;
import io.github.treetags.config.TagsConfig;
import io.github.treetags.profile.AddressMode;
import io.github.treetags.testutil.TestProfiles;
import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class TreetagsCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final StringWriter stderr = new StringWriter();
    private TreetagsCli cli;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(tempDir.resolve("main.go"), "package main\n\nfunc main() {}\n");
        Files.writeString(tempDir.resolve("util.py"), "def helper():\n    pass\n");
        var generator = new TagGenerator(
                config -> new TagGenerator.LoadedProfiles(TestProfiles.builtIns(), List.of()), stdout);
        cli = new TreetagsCli(tempDir, generator);
        commandLine = new CommandLine(cli);
        commandLine.setErr(new PrintWriter(stderr));
    }

    private TagsConfig parse(String... args) {
        commandLine.parseArgs(args);
        return cli.toConfig();
    }

    @Test
    void defaults() {
        var config = parse();
        assertEquals("tags", config.tagFile());
        assertFalse(config.append());
        assertTrue(config.sort());
        assertEquals(4, config.workers());
        assertTrue(config.inputs().isEmpty());
        assertEquals(ExtrasConfig.none(), config.extras());
        assertNull(config.addressOverride());
        assertEquals(tempDir, config.workingDirectory());
    }

    @Test
    void optionsMapOntoConfiguration() {
        var config = parse(
                "-f", "out/tags", "--append=yes", "--sort=no", "--workers", "2", "--exclude", "vendor",
                "--fields=+nS", "--extras=+q", "--kinds", "go=fs", "--kinds", "python=-v", "--excmd", "number",
                "main.go", "util.py");

        assertEquals("out/tags", config.tagFile());
        assertTrue(config.append());
        assertFalse(config.sort());
        assertEquals(2, config.workers());
        assertEquals(List.of("vendor"), config.excludes());
        assertTrue(config.fields().isEnabled('n'));
        assertTrue(config.fields().isEnabled('S'));
        assertTrue(config.extras().qualified());
        assertEquals(Map.of("go", "fs", "python", "-v"), config.kindSpecs());
        assertEquals(AddressMode.LINE, config.addressOverride());
        assertEquals(List.of(Path.of("main.go"), Path.of("util.py")), config.inputs());
    }

    @Test
    void nonBooleanFlagValueIsAnInputFile() {
        var config = parse("--append", "main.go", "util.py");
        assertTrue(config.append());
        assertEquals(List.of(Path.of("main.go"), Path.of("util.py")), config.inputs());

        var sorted = parse("--sort", "off");
        assertFalse(sorted.sort());
        assertTrue(sorted.inputs().isEmpty());
    }

    @Test
    void compatibilityOptionsAreAccepted() {
        var config = parse("--format=2", "--language-force=go", "--options=NONE", "main.go");
        assertEquals(List.of(Path.of("main.go")), config.inputs());
    }

    @Test
    void writesTagFileAndExitsZero() throws Exception {
        Path tags = tempDir.resolve("tags");
        int exit = commandLine.execute("-f", tags.toString(), "--fields=+n");

        assertEquals(0, exit, stderr.toString());
        var lines = Files.readAllLines(tags, StandardCharsets.UTF_8);
        assertTrue(lines.contains("helper\tutil.py\t/^def helper():$/;\"\tf\tline:1"), lines.toString());
        assertTrue(lines.contains("main\tmain.go\t/^func main() {}$/;\"\tf\tline:3"), lines.toString());
    }

    @Test
    void standardOutput() {
        int exit = commandLine.execute("-f", "-", "main.go");
        assertEquals(0, exit);
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("main\tmain.go\t/^package main$/;\"\tp\n"));
    }

    @Test
    void appendWithoutTagFileExitsOne() {
        int exit = commandLine.execute("-f", tempDir.resolve("missing-tags").toString(), "--append");

        assertEquals(1, exit);
        assertTrue(stderr.toString().contains("tag file does not exist"), stderr.toString());
        assertFalse(Files.exists(tempDir.resolve("missing-tags")));
    }

    @Test
    void fileErrorsAreWarningsNotFailures() throws Exception {
        Files.write(tempDir.resolve("bad.py"), new byte[] {(byte) 0xFF, '\n'});

        int exit = commandLine.execute("-f", tempDir.resolve("tags").toString());

        assertEquals(0, exit);
        assertTrue(stderr.toString().contains("warning: " + tempDir.resolve("bad.py")), stderr.toString());
    }

    @Test
    void invalidExcmdIsAUsageError() {
        int exit = commandLine.execute("--excmd", "regex");
        assertEquals(CommandLine.ExitCode.USAGE, exit);
    }
}
