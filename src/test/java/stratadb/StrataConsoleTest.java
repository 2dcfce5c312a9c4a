package stratadb;

import stratadb.datastore.StrataEngine;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrataConsoleTest {

    private List<String> run(String... lines) {
        StringWriter output = new StringWriter();
        BufferedReader in = new BufferedReader(new StringReader(String.join("\n", lines)));
        new StrataConsole(new StrataEngine(), in, new PrintWriter(output)).listen();
        return output.toString().lines().toList();
    }

    @Test
    void test_getPrintsValueOrNull() {
        assertEquals(List.of("1", "NULL"), run("SET a 1", "GET a", "GET b"));
    }

    @Test
    void test_numEqualTo() {
        assertEquals(List.of("2", "0"), run("SET a 1", "SET a 2", "SET b 2", "NUMEQUALTO 2", "NUMEQUALTO 1"));
    }

    @Test
    void test_nestedRollback() {
        assertEquals(List.of("10"), run("BEGIN", "SET a 10", "BEGIN", "SET a 20", "ROLLBACK", "GET a"));
    }

    @Test
    void test_rollbackRestoresUnset() {
        assertEquals(List.of("NULL", "10"), run("SET a 10", "BEGIN", "UNSET a", "GET a", "ROLLBACK", "GET a"));
    }

    @Test
    void test_noTransaction() {
        assertEquals(List.of("NO TRANSACTION", "NO TRANSACTION"), run("ROLLBACK", "COMMIT"));
    }

    @Test
    void test_commitClosesEveryBlock() {
        assertEquals(List.of("3", "NO TRANSACTION"),
                run("SET a 1", "BEGIN", "SET a 2", "BEGIN", "SET a 3", "COMMIT", "GET a", "ROLLBACK"));
    }

    @Test
    void test_invalidCommandsAreReportedAndSkipped() {
        assertEquals(List.of(
                        StrataConsole.INVALID_COMMAND_REPLY,
                        StrataConsole.INVALID_COMMAND_REPLY,
                        StrataConsole.INVALID_COMMAND_REPLY,
                        "x"),
                run("FOO a", "SET a", "BEGIN now", "set k x", "get k"));
    }

    @Test
    void test_blankLinesAreIgnored() {
        assertEquals(List.of("v"), run("", "SET k v", "   ", "GET k"));
    }

    @Test
    void test_endStopsProcessing() {
        assertEquals(List.of("1"), run("SET a 1", "GET a", "END", "GET a"));
        assertEquals(List.of("1"), run("SET a 1", "GET a", "end", "GET a"));
    }

    @Test
    void test_endWithArgumentsIsInvalid() {
        assertEquals(List.of(StrataConsole.INVALID_COMMAND_REPLY, "1"), run("SET a 1", "END now", "GET a"));
    }
}
