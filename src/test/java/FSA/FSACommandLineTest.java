package FSA;

import FSA.Compare.Equivalence;
import FSA.Model.FiniteAutomaton;
import FSA.Model.UnsupportedAutomatonKindException;
import net.automatalib.exception.FormatException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

class FSACommandLineTest {
  @Test
  void testTransform() throws IOException, FormatException {
    FiniteAutomaton<String> dfa = BAFormatTest.readResource("eightStates.ba");
    Assertions.assertEquals(7, FSACommandLine.transform("trim", dfa).size()); // sink 7 is dead
    Assertions.assertEquals(4, FSACommandLine.transform("minimize", dfa).size());
    Assertions.assertEquals(4, FSACommandLine.transform("MINIMIZE", dfa).size());

    FiniteAutomaton<String> nfa = BAFormatTest.readResource("thirdLastIsA.ba");
    FiniteAutomaton<String> determinized = FSACommandLine.transform("determinize", nfa);
    Assertions.assertEquals(8, determinized.size());
    Assertions.assertTrue(Equivalence.equivalent(nfa, determinized));
    Assertions.assertThrows(UnsupportedAutomatonKindException.class, () -> FSACommandLine.transform("minimize", nfa));
  }

  @Test
  void testCompare() throws IOException, FormatException {
    FiniteAutomaton<String> dfa = BAFormatTest.readResource("eightStates.ba");
    FiniteAutomaton<String> min = FSACommandLine.transform("minimize", dfa);
    Assertions.assertTrue(FSACommandLine.compare("equivalent", dfa, min));
    Assertions.assertFalse(FSACommandLine.compare("isomorphic", dfa, min));
    Assertions.assertTrue(FSACommandLine.compare("isomorphic", min, FSACommandLine.transform("minimize", min)));

    FiniteAutomaton<String> nfa = BAFormatTest.readResource("thirdLastIsA.ba");
    Assertions.assertFalse(FSACommandLine.compare("equivalent", dfa, nfa));
  }

  @Test
  void testUnknownCommand() throws IOException, FormatException {
    FiniteAutomaton<String> dfa = BAFormatTest.readResource("eightStates.ba");
    Assertions.assertThrows(IllegalStateException.class, () -> FSACommandLine.transform("reverse", dfa));
    Assertions.assertThrows(IllegalStateException.class, () -> FSACommandLine.compare("trim", dfa, dfa));
  }

  @Test
  void testMainWritesBA(@TempDir Path tempDir) throws URISyntaxException, IOException, FormatException {
    String input = Paths.get(FSACommandLineTest.class.getResource("/eightStates.ba").toURI()).toString();
    File output = tempDir.resolve("min.ba").toFile();

    FSACommandLine.main(new String[]{"--writeBA", output.getPath(), "minimize", input});

    Assertions.assertTrue(output.exists());
    FiniteAutomaton<String> written = BAFormat.getBAFile(output.getPath());
    Assertions.assertTrue(Equivalence.equivalent(written, BAFormatTest.readResource("eightStates.ba")));
  }
}
