package com.github.sybila.bisim.parser;

import com.github.sybila.bisim.Models;
import com.github.sybila.bisim.check.BisimilarityChecker;
import com.github.sybila.bisim.lts.ExplicitTransitionSystem;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

final class LtsParserTest {

    @Test
    void testParseTriplets() throws LtsParseException {
        ParsedLts parsed = LtsParser.parse("s0 a s1\ns1\tb   s0\n");
        ExplicitTransitionSystem<String, String> lts = parsed.getSystem();
        assertThat(lts.getStates()).containsExactly("s0", "s1");
        assertThat(lts.getActions()).containsExactly("a", "b");
        assertThat(lts.successors("s1", "b")).containsExactly("s0");
        assertThat(parsed.hasWarnings()).isFalse();
    }

    @Test
    void testFirstTransitionSourceIsInitial() throws LtsParseException {
        ParsedLts parsed = LtsParser.parse("# header\n\nq1 x q2\nq0 y q1\n");
        assertThat(parsed.getSystem().getInitialState()).isEqualTo("q1");
    }

    @Test
    void testCommentsAndBlankLinesAreSkipped() throws LtsParseException {
        ParsedLts parsed = LtsParser.parse("# a comment\n   \n  # indented comment\ns a t\n\n");
        assertThat(parsed.getSystem().getTransitions()).hasSize(1);
        assertThat(parsed.getMalformedLines()).isEmpty();
    }

    @Test
    void testMalformedLinesAreReportedAndSkipped() throws IOException, LtsParseException {
        ParsedLts parsed = LtsParser.parse(Models.resource("with_malformed.lts"));
        assertThat(parsed.hasWarnings()).isTrue();
        assertThat(parsed.getMalformedLines()).containsExactly(
                new MalformedLine(3, "this line is broken"),
                new MalformedLine(6, "s1 tea"));
        assertThat(parsed.getSystem().getTransitions()).hasSize(2);
        assertThat(parsed.getSystem().getInitialState()).isEqualTo("s0");
        assertThat(parsed.getMalformedLines().get(0).toString()).isEqualTo("line 3: this line is broken");
    }

    @Test
    void testEmptyFile() {
        LtsParseException e = catchThrowableOfType(() -> LtsParser.parse(Models.resource("empty.lts")), LtsParseException.class);
        assertThat(e).isNotNull();
        assertThat(e.getKind()).isEqualTo(LtsParseException.Kind.NO_VALID_TRANSITIONS);
    }

    @Test
    void testCommentsOnly() {
        assertThat(catchThrowable(() -> LtsParser.parse(Models.resource("comments_only.lts"))))
                .isInstanceOf(LtsParseException.class)
                .hasMessageContaining("no valid transitions");
    }

    @Test
    void testOnlyMalformedLines() {
        LtsParseException e = catchThrowableOfType(() -> LtsParser.parse("a b\nc d e f\n"), LtsParseException.class);
        assertThat(e).isNotNull();
        assertThat(e.getKind()).isEqualTo(LtsParseException.Kind.NO_VALID_TRANSITIONS);
    }

    @Test
    void testParseReader() throws IOException, LtsParseException {
        ParsedLts parsed = LtsParser.parse(new StringReader("x go y\n"));
        assertThat(parsed.getSystem().successors("x", "go")).containsExactly("y");
    }

    @Test
    void testMissingFile() {
        assertThatThrownBy(() -> LtsParser.parse(Path.of("does", "not", "exist.lts")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void testLoadedPairs() throws IOException, LtsParseException {
        BisimilarityChecker checker = new BisimilarityChecker();
        assertThat(checker.areBisimilar(load("b1.lts"), load("b2.lts"))).isTrue();
        assertThat(checker.areBisimilar(load("nb1.lts"), load("nb2.lts"))).isTrue();
        assertThat(checker.areBisimilar(load("test1.lts"), load("test2.lts"))).isTrue();
        assertThat(checker.areBisimilar(load("non_b_1.lts"), load("non_b_2.lts"))).isFalse();
        assertThat(checker.areBisimilar(load("non_b_struct1.lts"), load("non_b_struct2.lts"))).isFalse();
    }

    private static ExplicitTransitionSystem<String, String> load(String name) throws IOException, LtsParseException {
        return LtsParser.parse(Models.resource(name)).getSystem();
    }
}
