package info.isaksson.erland.tonto.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.tonto.symbols.ClassSymbol;
import info.isaksson.erland.tonto.symbols.DatatypeSymbol;
import info.isaksson.erland.tonto.symbols.EnumSymbol;
import info.isaksson.erland.tonto.symbols.GensetSymbol;
import info.isaksson.erland.tonto.symbols.RelationSymbol;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.List;
import java.util.stream.Collectors;

/** Serializable snapshot of a {@link SymbolTable}. Every list is in declaration order. */
@JsonPropertyOrder({"classes", "relations", "gensets", "datatypes", "enums"})
public final class SymbolsView {
    public final List<ClassSymbol> classes;
    public final List<RelationSymbol> relations;
    public final List<GensetSymbol> gensets;
    public final List<DatatypeSymbol> datatypes;
    public final List<EnumSymbol> enums;

    private SymbolsView(SymbolTable t) {
        this.classes = List.copyOf(t.classes().values());
        this.relations = List.copyOf(t.relations());
        this.gensets = List.copyOf(t.gensets().values());
        this.datatypes = List.copyOf(t.datatypes().values());
        this.enums = List.copyOf(t.enums().values());
    }

    /** Class names in declaration order. */
    public List<String> classNames() {
        return classes.stream().map(ClassSymbol::name).collect(Collectors.toList());
    }

    static SymbolsView of(SymbolTable table) {
        return new SymbolsView(table == null ? new SymbolTable() : table);
    }
}
