package FSA;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import FSA.Model.FiniteAutomaton;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

public class BAFormat {

    private BAFormat() {}

    /*
    We just use the parser from Automatalib and convert from a CompactNFA<String>
     */
    public static FiniteAutomaton<String> read(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        return AutomataLibConversions.fromCompactNFA(automaton);
    }

    /**
     * Write the automaton in BA format. Epsilon moves are removed by closure first, the format has none.
     */
    public static void write(OutputStream os, FiniteAutomaton<String> automaton) throws IOException {
        final CompactNFA<String> nfa = AutomataLibConversions.toCompactNFA(automaton, automaton.getInputAlphabet());
        new BAWriter<String>().writeModel(os, nfa, nfa.getInputAlphabet());
    }

    static FiniteAutomaton<String> getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    static void writeBAFile(String filePath, FiniteAutomaton<String> automaton) {
        try (OutputStream os = new FileOutputStream(filePath)) {
            write(os, automaton);
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
    }
}
