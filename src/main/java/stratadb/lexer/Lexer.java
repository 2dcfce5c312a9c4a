package stratadb.lexer;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.util.List;

public class Lexer {

    private static final Splitter TOKEN_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    public List<String> tokenize(String command) throws IllegalArgumentException {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Empty or null command");
        }

        return TOKEN_SPLITTER.splitToList(command);
    }
}
