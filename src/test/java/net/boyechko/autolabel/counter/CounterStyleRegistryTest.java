/*
 * AutoLabel - Counter-based labelling for document trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.autolabel.counter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class CounterStyleRegistryTest {
    private static CounterStyleRegistry registry;

    @BeforeAll
    static void loadRegistry() {
        registry = CounterStyleRegistry.loadDefault();
    }

    private String format(String name, int value) {
        CounterStyle style = registry.get(name);
        assertNotNull(style, "Unknown counter style " + name);
        return style.format(value);
    }

    static Stream<String> styleNames() {
        return CounterStyleRegistry.loadDefault().names().stream();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("styleNames")
    void separateRegistriesFormatIdentically(String name) {
        CounterStyleRegistry first = CounterStyleRegistry.loadDefault();
        CounterStyleRegistry second = CounterStyleRegistry.loadDefault();
        CounterStyle a = first.get(name);
        CounterStyle b = second.get(name);

        assertNotNull(a, name);
        assertNotSame(a, b);
        assertEquals(a, b);
        int[] values = {-1000, -11, -1, 0, 1, 2, 9, 10, 26, 27, 99, 100, 3999, 4000, 65536};
        for (int value : values) {
            String formatted = a.format(value);
            assertEquals(formatted, b.format(value), name + " at " + value);
            assertEquals(formatted, a.format(value), name + " repeated at " + value);
        }
    }

    @ParameterizedTest
    @CsvSource({
        "1, 1, 1", "decimal, 9, 9", "decimal, 91, 91", "decimal, 999, 999",
        "binary, 1, 1", "binary, 9, 1001", "binary, 91, 1011011", "binary, 999, 1111100111",
        "octal, 9, 11", "octal, 91, 133", "octal, 999, 1747",
        "lower-hexadecimal, 91, 5b", "lower-hexadecimal, 999, 3e7",
        "upper-hexadecimal, 91, 5B", "upper-hexadecimal, 999, 3E7",
        "decimal-leading-zero, 1, 01", "decimal-leading-zero, 9, 09",
        "decimal-leading-zero, 91, 91", "decimal-leading-zero, 999, 999",
        "a, 1, a", "lower-alpha, 9, i", "lower-latin, 91, cm", "lower-alpha, 999, alk",
        "A, 1, A", "upper-alpha, 9, I", "upper-latin, 91, CM", "upper-alpha, 999, ALK",
        "i, 1, i", "lower-roman, 9, ix", "lower-roman, 91, xci", "lower-roman, 999, cmxcix",
        "I, 1, I", "upper-roman, 9, IX", "upper-roman, 91, XCI", "upper-roman, 999, CMXCIX"
    })
    void formatsBasicStyles(String name, int value, String expected) {
        assertEquals(expected, format(name, value));
    }

    @Test
    void lowerGreekIsAlphabeticWithDecimalZero() {
        List<String> letters =
                List.of(
                        "α", "β", "γ", "δ", "ε", "ζ", "η", "θ", "ι", "κ", "λ", "μ", "ν", "ξ", "ο",
                        "π", "ρ", "σ", "τ", "υ", "φ", "χ", "ψ", "ω");
        assertEquals("0", format("lower-greek", 0));
        for (int i = 0; i < letters.size(); i++) {
            assertEquals(letters.get(i), format("lower-greek", i + 1));
        }
        assertEquals("αα", format("lower-greek", 25));
        assertEquals("βγ", format("lower-greek", 51));
    }

    @ParameterizedTest
    @CsvSource({
        "1, ፩", "9, ፱", "10, ፲", "11, ፲፩", "19, ፲፱", "20, ፳", "30, ፴", "90, ፺",
        "100, ፻", "111, ፻፲፩", "222, ፪፻፳፪", "444, ፬፻፵፬", "475, ፬፻፸፭",
        "83692, ፰፼፴፮፻፺፪", "78010092, ፸፰፻፩፼፺፪"
    })
    void formatsEthiopicNumeric(int value, String expected) {
        assertEquals(expected, format("ethiopic-numeric", value));
    }

    @Test
    void ethiopicZeroFallsBack() {
        assertEquals("0", format("ethiopic-numeric", 0));
    }

    @ParameterizedTest
    @CsvSource({
        "0, 零、", "1, 一、", "9, 九、", "10, 十、", "11, 十一、", "19, 十九、", "20, 二十、",
        "21, 二十一、", "100, 一百、", "105, 一百零五、", "110, 一百一十、", "120, 一百二十、",
        "444, 四百四十四、", "-1, 负一、", "-9, 负九、", "-120, 负一百二十、"
    })
    void formatsSimplifiedChineseInformal(int value, String expected) {
        assertEquals(expected, format("simp-chinese-informal", value));
    }

    @ParameterizedTest
    @CsvSource({
        "0, 零、", "1, 壹、", "2, 贰、", "10, 拾、", "12, 拾贰、", "20, 贰拾、", "105, 壹佰零伍、",
        "110, 壹佰壹拾、", "333, 叁佰叁拾叁、", "-120, 负壹佰贰拾、"
    })
    void formatsSimplifiedChineseFormal(int value, String expected) {
        assertEquals(expected, format("simp-chinese-formal", value));
    }

    @ParameterizedTest
    @CsvSource({
        "trad-chinese-informal, 21, 二十一、",
        "trad-chinese-informal, -1, 負一、",
        "trad-chinese-formal, 2, 貳、",
        "trad-chinese-formal, 13, 拾參、",
        "trad-chinese-formal, -120, 負壹佰貳拾、",
        "cjk-ideographic, 111, 一百一十一、"
    })
    void formatsTraditionalChinese(String name, int value, String expected) {
        assertEquals(expected, format(name, value));
    }

    @Test
    void chineseBeyondRangeFallsBackToCjkDecimal() {
        assertEquals("一〇〇〇〇", format("simp-chinese-informal", 10000));
    }

    @Test
    void romanNumeralsFallBackOutsideTheirRange() {
        assertEquals("0", format("upper-roman", 0));
        assertEquals("MMMCMXCIX", format("upper-roman", 3999));
        assertEquals("4000", format("upper-roman", 4000));
    }

    @Test
    void aliasesResolveToCanonicalStyles() {
        assertSame(registry.get("decimal"), registry.get("1"));
        assertSame(registry.get("lower-roman"), registry.get("i"));
        assertEquals("upper-alpha", registry.canonicalName("A"));
        assertEquals("lower-alpha", registry.get("a").cssId());
    }

    @Test
    void stylesAreConstructedOnce() {
        assertSame(registry.get("hebrew"), registry.get("hebrew"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"decimal", "disc", "hiragana", "armenian", "georgian", "lao"})
    void knowsPredefinedStyles(String name) {
        assertTrue(registry.isKnown(name));
        assertTrue(registry.names().contains(name));
    }

    @Test
    void unknownNamesGiveNull() {
        assertFalse(registry.isKnown("H"));
        assertNull(registry.get("no-such-style"));
    }

    @Test
    void defaultTableIsConsistent() {
        assertEquals(List.of(), registry.validateConsistency());
    }

    @Test
    void missingResourceFailsToLoad() {
        assertThrows(
                RuntimeException.class,
                () -> CounterStyleRegistry.fromResource("/no-such-counter-styles.yaml"));
    }

    @Test
    void selfReferentialBaseIsRejected() {
        CounterStyleTable table = new CounterStyleTable();
        CounterStyleTable.Definition loop = new CounterStyleTable.Definition();
        loop.base = "loop";
        table.styles = Map.of("loop", loop);

        CounterStyleRegistry custom = new CounterStyleRegistry(table);
        assertThrows(IllegalArgumentException.class, () -> custom.get("loop"));
    }

    @Test
    void derivedDefinitionOverridesBaseSettings() {
        CounterStyleTable table = new CounterStyleTable();
        CounterStyleTable.Definition base = new CounterStyleTable.Definition();
        base.system = "numeric";
        base.symbols = List.of("0", "1");
        base.suffix = ".";
        CounterStyleTable.Definition derived = new CounterStyleTable.Definition();
        derived.base = "bits";
        derived.pad_width = 4;
        table.styles = Map.of("bits", base, "nibble", derived);

        CounterStyleRegistry custom = new CounterStyleRegistry(table);
        assertEquals("0101.", custom.get("nibble").format(5));
    }

    @Test
    void danglingNamesAreReportedAsWarnings() {
        CounterStyleTable table = new CounterStyleTable();
        CounterStyleTable.Definition orphan = new CounterStyleTable.Definition();
        orphan.system = "cyclic";
        orphan.symbols = List.of("*");
        orphan.fallback = "missing";
        table.styles = Map.of("orphan", orphan);
        table.aliases = Map.of("o", "nowhere");

        List<String> warnings = new CounterStyleRegistry(table).validateConsistency();
        assertEquals(2, warnings.size());
    }
}
