package stratadb.parser;

/**
 * A decoded command line. {@code key} is the name argument of SET, GET and UNSET;
 * {@code value} is the value argument of SET and NUMEQUALTO. Unused arguments are {@code null}.
 */
public record Request(Command command, String key, String value) {
}
