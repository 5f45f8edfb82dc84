package FSA;

import FSA.Compare.BisimulationUpToCongruence;
import FSA.Model.FiniteAutomaton;
import net.automatalib.word.Word;

import java.util.ArrayList;
import java.util.List;

public class FSACommandLine {
  public static void main(String[] args) {
    String filename = null;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        ValmariMinimizer.DEBUG = true;
        BisimulationUpToCongruence.DEBUG = true;
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeBA");
          printUsageAndExit(); // exits
        }
        filename = args[++i]; // consume the value
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2 || positional.size() > 3) {
      printUsageAndExit();
    }

    String command = positional.get(0);
    final FiniteAutomaton<String> first = BAFormat.getBAFile(positional.get(1));
    System.out.println("Input automaton size: " + first.size());
    System.out.println("Alphabet size: " + first.numInputs());

    long before = System.currentTimeMillis();
    if (positional.size() == 2) {
      FiniteAutomaton<String> result = transform(command, first);
      long after = System.currentTimeMillis();
      System.out.println(command + " result size: " + result.size());
      System.out.println(command + " duration: " + ((after - before) / 1000f) + "s");
      if (filename != null) {
        System.out.println("Writing to file: " + filename);
        BAFormat.writeBAFile(filename, result);
      }
    } else {
      final FiniteAutomaton<String> second = BAFormat.getBAFile(positional.get(2));
      System.out.println("Second automaton size: " + second.size());
      boolean result = compare(command, first, second);
      long after = System.currentTimeMillis();
      System.out.println(command + ": " + result);
      if (!result && "equivalent".equalsIgnoreCase(command)) {
        System.out.println("Separating word: " + describe(FSAOperations.findSeparatingWord(first, second)));
      }
      System.out.println(command + " duration: " + ((after - before) / 1000f) + "s");
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "FSA [--debug] [--writeBA <BA output file>] <command> <BA input file> [<second BA input file>]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--writeBA <BA output file> : Write the resulting automaton to specified output file");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  trim: Remove unreachable and dead states.");
    System.out.println("  minimize: Valmari-Lehtinen minimization of a DFA.");
    System.out.println("  determinize: Subset construction followed by minimization.");
    System.out.println("  equivalent: Language equivalence of two automata (needs two files).");
    System.out.println("  isomorphic: Structural isomorphism of two DFAs (needs two files).");

    System.out.println();
    System.out.println("<BA file> : finite automaton (in the BA format).");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    System.exit(0);
  }

  /**
   * Run a command that produces a new automaton.
   * @param command - trim, minimize or determinize
   * @param automaton - input automaton
   * @return - resulting automaton
   */
  static FiniteAutomaton<String> transform(String command, FiniteAutomaton<String> automaton) {
    System.out.println();
    System.out.println("Invoking command:" + command);
    return switch (command.toLowerCase()) {
      case "trim" -> FSAOperations.trim(automaton);
      case "minimize" -> FSAOperations.minimize(automaton);
      case "determinize" -> PowersetDeterminizer.determinize(automaton, true);
      default -> throw new IllegalStateException("Unexpected command choice: " + command);
    };
  }

  /**
   * Run a command that compares two automata.
   * @param command - equivalent or isomorphic
   * @return - result of the comparison
   */
  static boolean compare(String command, FiniteAutomaton<String> a, FiniteAutomaton<String> b) {
    System.out.println();
    System.out.println("Invoking command:" + command);
    return switch (command.toLowerCase()) {
      case "equivalent" -> FSAOperations.equivalent(a, b);
      case "isomorphic" -> FSAOperations.isomorphic(a, b);
      default -> throw new IllegalStateException("Unexpected command choice: " + command);
    };
  }

  private static String describe(Word<String> word) {
    return word.isEmpty() ? "<empty word>" : word.toString();
  }
}
