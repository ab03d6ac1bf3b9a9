package dumb.afsolve;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import dumb.afsolve.LabellingSearch.BranchOrder;
import dumb.afsolve.util.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AfSolveTest extends AbstractTest {

    @TempDir
    Path dir;
    private Path file;
    private ByteArrayOutputStream out, err;

    @BeforeEach
    void setUp() throws IOException {
        file = dir.resolve("floating.apx");
        Files.writeString(file, FLOATING);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return AfSolve.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).strip();
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8).strip();
    }

    @Test
    void printsYes() {
        assertEquals(0, run("-f", file.toString(), "-p", "DS-ST", "-a", "d"));
        assertEquals(AfSolve.YES, stdout());
    }

    @Test
    void printsNo() {
        assertEquals(0, run("--file", file.toString(), "--problem", "DS-CO", "--arguments", "d"));
        assertEquals(AfSolve.NO, stdout());
    }

    @Test
    void verifiesArgumentSet() {
        assertEquals(0, run("-f", file.toString(), "-p", "VE-ST", "-a", "b,d"));
        assertEquals(AfSolve.YES, stdout());
    }

    @Test
    void bareArgumentsFlagMeansEmptySet() {
        assertEquals(0, run("-f", file.toString(), "-p", "VE-CO", "-a"));
        assertEquals(AfSolve.YES, stdout());
    }

    @Test
    void missingArgumentsMeansEmptySet() {
        assertEquals(0, run("-p", "VE-ST", "-f", file.toString()));
        assertEquals(AfSolve.NO, stdout());
    }

    @Test
    void arityErrorForSkepticalProblem() {
        assertEquals(1, run("-f", file.toString(), "-p", "DS-CO", "-a", "a,b"));
        assertTrue(stderr().startsWith("Error: Problem DS-CO expects exactly one argument"), stderr());
        assertEquals("", stdout());
    }

    @Test
    void unknownArgumentIsReported() {
        assertEquals(1, run("-f", file.toString(), "-p", "DC-CO", "-a", "zz"));
        assertTrue(stderr().contains("zz"), stderr());
    }

    @Test
    void reservedArgumentNameRejected() {
        assertEquals(1, run("-f", file.toString(), "-p", "DC-CO", "-a", "att"));
        assertTrue(stderr().startsWith("Error: Unaccepted argument(s)"), stderr());
    }

    @Test
    void unknownProblem() {
        assertEquals(1, run("-f", file.toString(), "-p", "DC-PR", "-a", "a"));
        assertTrue(stderr().contains("VE-CO, DC-CO, DS-CO, VE-ST, DC-ST, DS-ST"), stderr());
    }

    @Test
    void missingFile() {
        assertEquals(1, run("-f", dir.resolve("nope.apx").toString(), "-p", "DC-CO", "-a", "a"));
        assertTrue(stderr().contains("does not exist"), stderr());
    }

    @Test
    void malformedFile() throws IOException {
        var bad = dir.resolve("bad.apx");
        Files.writeString(bad, "arg(a).\natt(a;b).\n");
        assertEquals(1, run("-f", bad.toString(), "-p", "DC-CO", "-a", "a"));
        assertTrue(stderr().startsWith("Error: Expected ','"), stderr());
    }

    @Test
    void usageErrors() {
        assertEquals(1, run("-p", "DC-CO"));
        assertEquals(1, run("-f"));
        assertEquals(1, run("--bogus"));
        assertTrue(stderr().contains("Usage"));
    }

    @Test
    void help() {
        assertEquals(0, run("-h"));
        assertTrue(stdout().startsWith("Usage"));
    }

    @Test
    void readsConfiguration() throws IOException {
        var config = dir.resolve("config.json");
        Files.writeString(config, "{\"branchOrder\": \"MOST_CONNECTED\", \"logStats\": true}");
        assertEquals(0, run("-f", file.toString(), "-p", "DC-ST", "-a", "b", "-c", config.toString()));
        assertEquals(AfSolve.YES, stdout());
    }

    @Test
    void unreadableConfiguration() throws IOException {
        var config = dir.resolve("config.json");
        Files.writeString(config, "{\"timeoutMillis\": \"soon\"}");
        assertEquals(1, run("-f", file.toString(), "-p", "DC-ST", "-a", "b", "-c", config.toString()));
        assertTrue(stderr().startsWith("Error: Cannot read configuration"), stderr());
    }

    @Test
    void configurationDefaults() throws IOException {
        var config = Json.obj("{\"timeoutMillis\": 250}", AfSolve.Configuration.class);
        assertEquals(250, config.timeoutMillis());
        assertEquals(BranchOrder.INSERTION, config.branchOrder());
        assertFalse(config.logStats());
        assertEquals(new AfSolve.Configuration(), Json.obj("{}", AfSolve.Configuration.class));
        assertThrows(UnrecognizedPropertyException.class, () -> Json.obj("{\"depth\": 3}", AfSolve.Configuration.class));
    }

    @Test
    void splitsArgumentList() {
        assertEquals(set("a", "b"), AfSolve.splitArguments("a,b,a"));
        assertTrue(AfSolve.splitArguments(null).isEmpty());
        assertTrue(AfSolve.splitArguments("").isEmpty());
        assertEquals(set("a", ""), AfSolve.splitArguments("a,"));
    }
}
