package work.shellformats.toml.value;

/**
 * Kinds of pipeline values, with the names used in user-facing messages.
 */
public enum ValueType {
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BINARY("binary"),
    DURATION("duration"),
    DATE("date"),
    FILESIZE("filesize"),
    RANGE("range"),
    LIST("list"),
    RECORD("record"),
    BLOCK("block"),
    NOTHING("nothing"),
    ERROR("error"),
    CELL_PATH("cell path"),
    CUSTOM("custom");

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
