package FSA.Compare;

import java.util.ArrayList;
import java.util.List;

import FSA.Model.FiniteAutomaton;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.word.Word;

/**
 * Union of the alphabets of two automata: symbol k of the union has index left(k) in the left alphabet and right(k)
 * in the right one, -1 where the symbol is missing. Left symbols come first, in their alphabet order.
 */
public final class SymbolAlignment<I> {
    private final List<I> symbols;
    private final int[] left;
    private final int[] right;

    public SymbolAlignment(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        this.symbols = new ArrayList<>(a.numInputs() + b.numInputs());
        for (int i = 0; i < a.numInputs(); i++) {
            symbols.add(a.getSymbol(i));
        }
        for (int i = 0; i < b.numInputs(); i++) {
            final I symbol = b.getSymbol(i);
            if (a.getSymbolIndex(symbol) < 0) {
                symbols.add(symbol);
            }
        }
        this.left = new int[symbols.size()];
        this.right = new int[symbols.size()];
        for (int k = 0; k < symbols.size(); k++) {
            left[k] = a.getSymbolIndex(symbols.get(k));
            right[k] = b.getSymbolIndex(symbols.get(k));
        }
    }

    public int size() {
        return symbols.size();
    }

    public I symbol(int k) {
        return symbols.get(k);
    }

    public int left(int k) {
        return left[k];
    }

    public int right(int k) {
        return right[k];
    }

    /**
     * @param reversed symbol indices of the union, last symbol first
     */
    public Word<I> toWord(IntArrayList reversed) {
        final List<I> word = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            word.add(symbols.get(reversed.getInt(i)));
        }
        return Word.fromList(word);
    }

    /**
     * @return true iff both alphabets contain the same symbols
     */
    public boolean isShared() {
        for (int k = 0; k < symbols.size(); k++) {
            if (left[k] < 0 || right[k] < 0) {
                return false;
            }
        }
        return true;
    }
}
