package stratadb.parser;

public enum Command {
    SET(2),
    GET(1),
    UNSET(1),
    NUMEQUALTO(1),
    BEGIN(0),
    ROLLBACK(0),
    COMMIT(0),
    END(0);

    private final int arity;

    Command(int arity) {
        this.arity = arity;
    }

    public boolean accepts(int argumentCount) {
        return arity == argumentCount;
    }

    public int arity() { return arity; }
}
