package com.eainde.vocab.enrich;

import com.eainde.vocab.canonical.RowCanonicalizer;
import com.eainde.vocab.model.Row;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link DictionaryLookup} against the public Jisho word search API.
 *
 * <h3>Mapping of the first hit:</h3>
 * <ul>
 *   <li>term: {@code japanese[0].word}, else {@code japanese[0].reading}, else the query term</li>
 *   <li>reading: {@code japanese[0].reading}, else the hint</li>
 *   <li>meaning: up to two senses that are not Wikipedia definitions, each sense's
 *       definitions joined with {@code ", "}, senses joined with {@code "; "}</li>
 *   <li>jlpt: first {@code jlpt-nX} tag as {@code NX}</li>
 *   <li>example: Japanese text of the first hit of the HTML sentence search for the query term,
 *       furigana removed; empty when the page has no sentence or cannot be fetched</li>
 * </ul>
 */
@Slf4j
public class JishoDictionaryLookup implements DictionaryLookup {

    public static final String DEFAULT_BASE_URL = "https://jisho.org";

    private static final String SEARCH_PATH = "api/v1/search/words";
    private static final String SENTENCE_PATH = "search";
    private static final String SENTENCE_TAG = " #sentences";
    private static final String WIKIPEDIA = "Wikipedia definition";
    private static final int MAX_SENSES = 2;

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final ObjectMapper objectMapper;

    public JishoDictionaryLookup(OkHttpClient httpClient, String baseUrl, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Row> lookup(String term, String readingHint) {
        String query = RowCanonicalizer.normalize(term);
        String hint = RowCanonicalizer.normalize(readingHint);
        if (query.isEmpty()) return Optional.empty();

        JsonNode data = search(query);
        if (data.isEmpty() && !hint.isEmpty() && !hint.equals(query)) {
            log.debug("No Jisho entry for '{}', retrying with reading '{}'", query, hint);
            data = search(hint);
        }
        if (data.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toRow(data.get(0), query, hint, exampleSentence(query)));
    }

    // =========================================================================
    //  HTTP
    // =========================================================================

    private JsonNode search(String keyword) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments(SEARCH_PATH)
                .addQueryParameter("keyword", keyword)
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new DictionaryLookupException(
                        "Jisho search for '" + keyword + "' failed: HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                return objectMapper.createArrayNode();
            }
            JsonNode data = objectMapper.readTree(body.string()).path("data");
            return data.isArray() ? data : objectMapper.createArrayNode();
        } catch (IOException e) {
            throw new DictionaryLookupException("Jisho search for '" + keyword + "' failed", e);
        }
    }

    /**
     * @return the first sentence of the sentence search page, or empty on any failure
     */
    private String exampleSentence(String term) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment(SENTENCE_PATH)
                .addPathSegment(term + SENTENCE_TAG)
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "text/html")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.debug("No example sentence for '{}': HTTP {}", term, response.code());
                return "";
            }
            return firstSentence(Jsoup.parse(body.string(), url.toString()));
        } catch (IOException e) {
            log.debug("Example sentence lookup for '{}' failed: {}", term, e.getMessage());
            return "";
        }
    }

    static String firstSentence(Document page) {
        Element sentence = page.selectFirst("ul.japanese_sentence");
        if (sentence == null) {
            return "";
        }
        Element text = sentence.clone();
        text.select("span.furigana").remove();
        return text.text().replaceAll("\\s+", "");
    }

    // =========================================================================
    //  Mapping
    // =========================================================================

    private static Row toRow(JsonNode entry, String term, String hint, String example) {
        JsonNode japanese = entry.path("japanese").path(0);
        String word = japanese.path("word").asText("");
        String reading = japanese.path("reading").asText("");

        String outTerm = !word.isEmpty() ? word : !reading.isEmpty() ? reading : term;
        String outReading = !reading.isEmpty() ? reading : hint;

        return RowCanonicalizer.of(outTerm, outReading, meaningOf(entry), example, jlptOf(entry));
    }

    static String meaningOf(JsonNode entry) {
        List<String> picked = new ArrayList<>();
        for (JsonNode sense : entry.path("senses")) {
            if (containsText(sense.path("parts_of_speech"), WIKIPEDIA)) continue;

            List<String> definitions = new ArrayList<>();
            sense.path("english_definitions").forEach(d -> definitions.add(d.asText()));
            if (!definitions.isEmpty()) {
                picked.add(String.join(", ", definitions));
            }
            if (picked.size() >= MAX_SENSES) break;
        }
        return String.join("; ", picked);
    }

    static String jlptOf(JsonNode entry) {
        for (JsonNode tag : entry.path("jlpt")) {
            String level = RowCanonicalizer.normalizeJlpt(tag.asText("").replace("jlpt-", ""));
            if (!level.isEmpty()) return level;
        }
        return "";
    }

    private static boolean containsText(JsonNode array, String value) {
        for (JsonNode node : array) {
            if (value.equals(node.asText())) return true;
        }
        return false;
    }
}
