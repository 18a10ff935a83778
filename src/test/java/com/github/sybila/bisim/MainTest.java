package com.github.sybila.bisim;

import org.junit.jupiter.api.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

final class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static String model(String name) {
        return Models.resource(name).toString();
    }

    @Test
    void testBisimilar() {
        assertThat(run(model("b1.lts"), model("b2.lts"))).isEqualTo(Main.EXIT_BISIMILAR);
        assertThat(out().trim()).isEqualTo(ConsoleReporter.BISIMILAR);
    }

    @Test
    void testNotBisimilar() {
        assertThat(run(model("non_b_1.lts"), model("non_b_2.lts"))).isEqualTo(Main.EXIT_NOT_BISIMILAR);
        assertThat(out().trim()).isEqualTo(ConsoleReporter.NOT_BISIMILAR);
    }

    @Test
    void testPrintPartition() {
        assertThat(run("--partition", model("non_b_1.lts"), model("non_b_2.lts"))).isEqualTo(Main.EXIT_NOT_BISIMILAR);
        assertThat(out())
                .startsWith(ConsoleReporter.NOT_BISIMILAR)
                .contains("Classes (3):")
                .contains("{1:s1, 2:s1}")
                .contains("Left initial class: {1:s}")
                .contains("Right initial class: {2:s}");
    }

    @Test
    void testEmptyModel() {
        assertThat(run(model("b1.lts"), model("empty.lts"))).isEqualTo(Main.EXIT_ERROR);
        assertThat(out()).isEmpty();
        assertThat(err()).contains("no valid transitions");
    }

    @Test
    void testMalformedLinesAreLeftToTheLogger() {
        assertThat(run(model("with_malformed.lts"), model("with_malformed.lts"))).isEqualTo(Main.EXIT_BISIMILAR);
        assertThat(out().trim()).isEqualTo(ConsoleReporter.BISIMILAR);
        assertThat(err()).isEmpty();
    }

    @Test
    void testMissingFile() {
        assertThat(run(model("b1.lts"), "no-such-model.lts")).isEqualTo(Main.EXIT_ERROR);
        assertThat(err()).contains("Cannot read model");
    }

    @Test
    void testUsage() {
        assertThat(run(model("b1.lts"))).isEqualTo(Main.EXIT_ERROR);
        assertThat(err()).contains("Usage:");
        assertThat(run("--verbose", model("b1.lts"), model("b2.lts"))).isEqualTo(Main.EXIT_ERROR);
        assertThat(err()).contains("Unknown option: --verbose");
    }
}
