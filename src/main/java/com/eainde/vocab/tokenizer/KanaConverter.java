package com.eainde.vocab.tokenizer;

public final class KanaConverter {

    private static final char KATAKANA_FIRST = 'ァ';   // U+30A1
    private static final char KATAKANA_LAST = 'ヶ';    // U+30F6
    private static final int KANA_OFFSET = 0x60;

    private KanaConverter() {
    }

    /**
     * Shifts katakana in U+30A1..U+30F6 to hiragana. Other characters, including the
     * prolonged sound mark, pass through unchanged.
     */
    public static String katakanaToHiragana(String text) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch >= KATAKANA_FIRST && ch <= KATAKANA_LAST) {
                out.append((char) (ch - KANA_OFFSET));
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }
}
