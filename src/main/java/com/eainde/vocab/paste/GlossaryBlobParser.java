package com.eainde.vocab.paste;

import com.eainde.vocab.canonical.RowCanonicalizer;
import com.eainde.vocab.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a pasted glossary such as {@code 日本 (にほん) Japan, Japanese state 文化 culture}
 * into rows.
 *
 * <p>A term is a whitespace-free token holding at least one kana or kanji, optionally followed
 * by a reading in ASCII or full-width parentheses. Its meaning runs up to the next term or the
 * end of the text. Meanings are split on commas outside parentheses and re-joined with
 * {@code ", "}.</p>
 */
public class GlossaryBlobParser {

    private static final Logger log = LoggerFactory.getLogger(GlossaryBlobParser.class);

    private static final String JP_TOKEN =
            "(?:[^\\s（）()]*[\\u3040-\\u30FF\\u3400-\\u9FFF][^\\s（）()]*)";
    private static final String READING = "(?:\\s*[（(][^）)]+[）)])?";

    private static final Pattern TERM_BLOCK = Pattern.compile(
            "\\s*(?<term>" + JP_TOKEN + ")"
                    + "(?:\\s*[（(](?<reading>[^）)]+)[）)])?"
                    + "\\s+(?<meaning>.+?)"
                    + "(?=\\s+" + JP_TOKEN + READING + "\\s+|\\s*$)",
            Pattern.DOTALL);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public List<Row> parse(String blob) {
        if (blob == null || blob.isBlank()) return List.of();

        String text = WHITESPACE.matcher(blob.strip()).replaceAll(" ");
        List<Row> rows = new ArrayList<>();
        Matcher m = TERM_BLOCK.matcher(text);
        while (m.find()) {
            String term = m.group("term");
            String reading = m.group("reading");
            String meaning = String.join(", ", splitMeanings(m.group("meaning")));
            rows.add(RowCanonicalizer.of(term, reading, meaning));
        }
        log.debug("Parsed {} rows from {} chars of pasted text", rows.size(), text.length());
        return rows;
    }

    /**
     * Splits on commas that are not inside ASCII parentheses; semicolons are left alone.
     */
    static List<String> splitMeanings(String raw) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')' && depth > 0) {
                depth--;
            }
            if (ch == ',' && depth == 0) {
                addIfPresent(parts, current);
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        addIfPresent(parts, current);
        return parts;
    }

    private static void addIfPresent(List<String> parts, StringBuilder part) {
        String value = part.toString().strip();
        if (!value.isEmpty()) parts.add(value);
    }
}
