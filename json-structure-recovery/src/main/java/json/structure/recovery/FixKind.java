package json.structure.recovery;

/// The kinds of textual repair, in the order [FixSummary] reports them.
public enum FixKind {
    TRAILING_COMMA("trailing comma"),
    SINGLE_QUOTES("single quote conversion"),
    MISSING_COMMA("missing comma"),
    UNQUOTED_KEY("unquoted key");

    private final String label;

    FixKind(String label) {
        this.label = label;
    }

    /// {@return the singular noun used in fix summaries}
    public String label() {
        return label;
    }
}
