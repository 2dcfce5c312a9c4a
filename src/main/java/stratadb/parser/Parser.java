package stratadb.parser;

import java.util.List;
import java.util.Locale;

public class Parser {

    public Request parse(List<String> tokens) throws IllegalArgumentException {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Invalid command: No tokens found");
        }

        Command command = toCommand(tokens.get(0));
        int argumentCount = tokens.size() - 1;
        if (!command.accepts(argumentCount)) {
            throw new IllegalArgumentException(
                    command + " command requires exactly " + command.arity() + " arguments, got " + argumentCount);
        }

        return switch (command) {
            case SET -> new Request(command, tokens.get(1), tokens.get(2));
            case GET, UNSET -> new Request(command, tokens.get(1), null);
            case NUMEQUALTO -> new Request(command, null, tokens.get(1));
            case BEGIN, ROLLBACK, COMMIT, END -> new Request(command, null, null);
        };
    }

    private Command toCommand(String verb) {
        try {
            return Command.valueOf(verb.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown command: " + verb, e);
        }
    }
}
