package org.konoko.compiler.isa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static lookup between {@link Instruction}s and their two textual representations.
 * <p>
 * Natural spellings are a bijection with the instructions. The lexer additionally
 * accepts a small set of reading aliases; rendering always uses the canonical symbol.
 */
public final class SymbolTable {

    /** Smallest valid compact run length. */
    public static final int MIN_RUN_LENGTH = 1;
    /** Largest valid compact run length. */
    public static final int MAX_RUN_LENGTH = Instruction.values().length;

    private static final Map<String, Instruction> SYMBOLS = new HashMap<>();
    private static final Map<String, Instruction> ALIASES = Map.of(
            "獅子の子", Instruction.INCREMENT
    );
    private static final List<String> SPELLINGS_LONGEST_FIRST;

    static {
        for (Instruction instruction : Instruction.values()) {
            SYMBOLS.put(instruction.naturalSymbol(), instruction);
        }
        List<String> spellings = new ArrayList<>(SYMBOLS.keySet());
        spellings.addAll(ALIASES.keySet());
        spellings.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        SPELLINGS_LONGEST_FIRST = Collections.unmodifiableList(spellings);
    }

    private SymbolTable() {}

    /**
     * Resolves a natural-notation spelling, including reading aliases.
     * @param symbol The spelling to look up.
     * @return The instruction, or empty if the spelling is unknown.
     */
    public static Optional<Instruction> lookupSymbol(String symbol) {
        Instruction instruction = SYMBOLS.get(symbol);
        if (instruction == null) {
            instruction = ALIASES.get(symbol);
        }
        return Optional.ofNullable(instruction);
    }

    /**
     * Resolves a compact run length.
     * @param runLength The number of unit glyphs in a compact token.
     * @return The instruction, or empty if the length is outside 1..8.
     */
    public static Optional<Instruction> byRunLength(int runLength) {
        if (runLength < MIN_RUN_LENGTH || runLength > MAX_RUN_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(Instruction.values()[runLength - 1]);
    }

    /**
     * Returns every spelling the lexer recognises, longest first so that a greedy
     * scan prefers the longest match.
     * @return An unmodifiable list of spellings.
     */
    public static List<String> symbols() {
        return SPELLINGS_LONGEST_FIRST;
    }

    /**
     * Checks whether a character can start any recognised spelling.
     * @param c The character to test.
     * @return {@code true} if some symbol begins with {@code c}.
     */
    public static boolean startsSymbol(char c) {
        for (String spelling : SPELLINGS_LONGEST_FIRST) {
            if (spelling.charAt(0) == c) {
                return true;
            }
        }
        return false;
    }
}
