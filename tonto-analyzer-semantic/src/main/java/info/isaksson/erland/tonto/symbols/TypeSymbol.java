package info.isaksson.erland.tonto.symbols;

/** Anything an attribute type reference can resolve to. */
public interface TypeSymbol {
    String name();
}
