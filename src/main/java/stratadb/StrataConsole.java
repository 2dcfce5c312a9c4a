package stratadb;

import stratadb.datastore.TransactionalKeyValueStore;
import stratadb.lexer.Lexer;
import stratadb.parser.Command;
import stratadb.parser.Parser;
import stratadb.parser.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads one command per line, runs it against the store and prints its result.
 * The session ends on END or at end of input.
 */
public class StrataConsole {

    private static final Logger log = LoggerFactory.getLogger(StrataConsole.class);

    static final String NULL_REPLY = "NULL";
    static final String NO_TRANSACTION_REPLY = "NO TRANSACTION";
    static final String INVALID_COMMAND_REPLY = "Invalid method or number of arguments";

    private final TransactionalKeyValueStore store;
    private final BufferedReader in;
    private final PrintWriter out;
    private final Lexer lexer = new Lexer();
    private final Parser parser = new Parser();

    public StrataConsole(TransactionalKeyValueStore store, BufferedReader in, PrintWriter out) {
        this.store = store;
        this.in = in;
        this.out = out;
    }

    public void listen() {
        log.info("session started");
        int lines = 0;
        try {
            String line;
            while ((line = in.readLine()) != null) {
                lines++;
                if (!handleLine(line)) break;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read command after line " + lines, e);
        } finally {
            out.flush();
        }
        log.info("session ended after {} lines", lines);
    }

    /** @return {@code false} once the session should end */
    boolean handleLine(String line) {
        if (line.isBlank()) return true;

        Request request;
        try {
            List<String> tokens = lexer.tokenize(line);
            request = parser.parse(tokens);
        } catch (IllegalArgumentException e) {
            log.warn("rejected command '{}': {}", line, e.getMessage());
            out.println(INVALID_COMMAND_REPLY);
            return true;
        }

        if (request.command() == Command.END) return false;

        String response = processCommand(request);
        if (response != null) out.println(response);
        return true;
    }

    /** @return the line to print, or {@code null} when the command prints nothing */
    private String processCommand(Request request) {
        return switch (request.command()) {
            case SET -> {
                store.put(request.key(), request.value());
                yield null;
            }
            case GET -> {
                String value = store.get(request.key());
                yield value == null ? NULL_REPLY : value;
            }
            case UNSET -> {
                store.delete(request.key());
                yield null;
            }
            case NUMEQUALTO -> String.valueOf(store.numEqualTo(request.value()));
            case BEGIN -> {
                store.begin();
                yield null;
            }
            case ROLLBACK -> store.rollback() ? null : NO_TRANSACTION_REPLY;
            case COMMIT -> store.commit() ? null : NO_TRANSACTION_REPLY;
            case END -> throw new IllegalStateException("END is handled before dispatch");
        };
    }
}
