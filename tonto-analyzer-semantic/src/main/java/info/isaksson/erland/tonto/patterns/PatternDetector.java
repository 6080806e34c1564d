package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.symbols.SymbolTable;

/**
 * Finds every instance of one pattern family in a symbol table.
 *
 * <p>Implementations are stateless and only read the table.</p>
 */
public interface PatternDetector {

    PatternType type();

    DetectorOutput detect(SymbolTable table);
}
