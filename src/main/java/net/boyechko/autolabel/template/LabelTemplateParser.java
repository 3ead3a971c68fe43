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
package net.boyechko.autolabel.template;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.autolabel.counter.CounterStyle;
import net.boyechko.autolabel.counter.CounterStyleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses label template strings.
 *
 * <pre>
 * template := segment ( ',' segment )* [ ',' '*' ]
 * segment  := literal* [ ( marker literal* )? format literal* ]
 * marker   := 'X' | 'L' | 'H' | 'H1' .. 'H6'          (case-insensitive)
 * format   := [A-Za-z0-9]+ ( '-' [A-Za-z0-9]+ )*      (a counter style name)
 * literal  := any char except ASCII letters, digits and ',' | '"' ... '"' | "'" ... "'"
 * </pre>
 *
 * <p>Whitespace at the start of each segment is skipped. Inside quotes a doubled quote stands for
 * one quote character. A word naming a known counter style is always read as a format name;
 * otherwise a leading parent marker is split off it. Results are cached by source string.
 */
public class LabelTemplateParser {
    private static final Logger logger = LoggerFactory.getLogger(LabelTemplateParser.class);

    private final CounterStyleRegistry registry;
    private final Map<String, LabelTemplate> cache = new HashMap<>();

    public LabelTemplateParser(CounterStyleRegistry registry) {
        this.registry = registry;
    }

    public CounterStyleRegistry registry() {
        return registry;
    }

    public LabelTemplate parse(String template) throws LabelTemplateException {
        LabelTemplate cached = cache.get(template);
        if (cached != null) {
            return cached;
        }
        LabelTemplate parsed = new Scanner(template).parseTemplate();
        cache.put(template, parsed);
        logger.debug("Parsed label template '{}' as {}", template, parsed.toTemplateString());
        return parsed;
    }

    private record Segment(
            String prefix,
            ScopeSelector parentType,
            String separator,
            CounterStyle counterStyle,
            String suffix) {}

    private final class Scanner {
        private final String src;
        private int pos;

        Scanner(String src) {
            this.src = src;
        }

        LabelTemplate parseTemplate() throws LabelTemplateException {
            List<Segment> segments = new ArrayList<>();
            boolean repeating = false;

            while (true) {
                segments.add(parseSegment());
                if (pos >= src.length()) {
                    break;
                }
                if (src.charAt(pos) != ',') {
                    throw error("Expected ','", pos);
                }
                pos++;
                if (src.substring(pos).strip().equals("*")) {
                    repeating = true;
                    pos = src.length();
                    break;
                }
            }

            LabelTemplate child = null;
            for (int i = segments.size() - 1; i >= 0; i--) {
                Segment s = segments.get(i);
                if (repeating && i == segments.size() - 1) {
                    child =
                            LabelTemplate.repeating(
                                    s.prefix(),
                                    s.parentType(),
                                    s.separator(),
                                    s.counterStyle(),
                                    s.suffix());
                } else {
                    child =
                            new LabelTemplate(
                                    s.prefix(),
                                    s.parentType(),
                                    s.separator(),
                                    s.counterStyle(),
                                    s.suffix(),
                                    child);
                }
            }
            return child;
        }

        private Segment parseSegment() throws LabelTemplateException {
            while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
                pos++;
            }

            String prefix = readLiteral();
            if (!atWordStart()) {
                return new Segment(prefix, null, "", null, "");
            }

            int wordStart = pos;
            String word = peekWord();
            ScopeSelector parentType = null;
            String separator = "";
            CounterStyle style = registry.get(word);

            if (style != null) {
                pos += word.length();
            } else {
                String marker = peekMarker();
                if (marker == null) {
                    throw error("Unknown counter style '" + word + "'", wordStart);
                }
                parentType = ScopeSelector.fromMarker(marker);
                pos += marker.length();
                separator = readLiteral();
                if (!atWordStart()) {
                    throw error("Expected a counter style after '" + marker + "'", pos);
                }
                int formatStart = pos;
                String format = peekWord();
                style = registry.get(format);
                if (style == null) {
                    // "Hello" reads better in an error than "ello"
                    boolean wholeWord = formatStart == wordStart + marker.length();
                    throw error(
                            "Unknown counter style '" + (wholeWord ? word : format) + "'",
                            wholeWord ? wordStart : formatStart);
                }
                pos += format.length();
            }

            String suffix = readLiteral();
            return new Segment(prefix, parentType, separator, style, suffix);
        }

        private boolean atWordStart() {
            return pos < src.length() && isWordChar(src.charAt(pos));
        }

        /** Returns the word at the current position without consuming it. */
        private String peekWord() {
            int end = pos;
            while (true) {
                while (end < src.length() && isWordChar(src.charAt(end))) {
                    end++;
                }
                if (end + 1 < src.length()
                        && src.charAt(end) == '-'
                        && isWordChar(src.charAt(end + 1))) {
                    end++;
                } else {
                    break;
                }
            }
            return src.substring(pos, end);
        }

        /** Returns the parent marker at the current position, or null if there is none. */
        private String peekMarker() {
            char c = Character.toUpperCase(src.charAt(pos));
            if (c == 'X' || c == 'L') {
                return src.substring(pos, pos + 1);
            }
            if (c == 'H') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) >= '1'
                        && src.charAt(pos + 1) <= '6') {
                    return src.substring(pos, pos + 2);
                }
                return src.substring(pos, pos + 1);
            }
            return null;
        }

        private String readLiteral() throws LabelTemplateException {
            StringBuilder sb = new StringBuilder();
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '"' || c == '\'') {
                    readQuoted(c, sb);
                } else if (c == ',' || isWordChar(c)) {
                    break;
                } else {
                    sb.append(c);
                    pos++;
                }
            }
            return sb.toString();
        }

        private void readQuoted(char quote, StringBuilder sb) throws LabelTemplateException {
            int start = pos;
            pos++;
            while (true) {
                if (pos >= src.length()) {
                    throw error("Unterminated quoted literal", start);
                }
                char c = src.charAt(pos);
                if (c == quote) {
                    if (pos + 1 < src.length() && src.charAt(pos + 1) == quote) {
                        sb.append(quote);
                        pos += 2;
                    } else {
                        pos++;
                        return;
                    }
                } else {
                    sb.append(c);
                    pos++;
                }
            }
        }

        private LabelTemplateException error(String message, int offset) {
            return new LabelTemplateException(message, src, offset);
        }
    }

    /** ASCII letters and digits only; every other character, CJK included, is literal text. */
    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
