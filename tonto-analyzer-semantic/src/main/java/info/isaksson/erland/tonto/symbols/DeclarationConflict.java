package info.isaksson.erland.tonto.symbols;

/** Two declarations of the same name in one namespace; the later one replaced the earlier. */
public final class DeclarationConflict {
    public final String namespace;
    public final String name;
    public final int firstLine;
    public final int line;
    public final int column;

    public DeclarationConflict(String namespace, String name, int firstLine, int line, int column) {
        this.namespace = namespace;
        this.name = name;
        this.firstLine = firstLine;
        this.line = line;
        this.column = column;
    }

    @Override
    public String toString() {
        return namespace + " '" + name + "' at line " + line + " (first declared at line " + firstLine + ")";
    }
}
