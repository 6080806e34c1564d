package info.isaksson.erland.tonto;

import info.isaksson.erland.tonto.ast.TontoFile;
import info.isaksson.erland.tonto.parser.ParseResult;
import info.isaksson.erland.tonto.parser.Parser;
import info.isaksson.erland.tonto.symbols.SymbolTable;
import info.isaksson.erland.tonto.symbols.SymbolTableBuilder;

/** Parses inline Tonto sources for semantic tests. Sources must be free of syntax errors. */
public final class ModelFixtures {
    private ModelFixtures() {}

    public static TontoFile parse(String... lines) {
        String source = "package Test\n" + String.join("\n", lines) + "\n";
        ParseResult r = new Parser().parse(source, "test.tonto");
        if (r.hasErrors()) {
            throw new IllegalStateException("fixture does not parse: " + r.lexicalErrors + " " + r.syntaxErrors);
        }
        return r.file;
    }

    public static SymbolTable table(String... lines) {
        return SymbolTableBuilder.build(parse(lines));
    }
}
