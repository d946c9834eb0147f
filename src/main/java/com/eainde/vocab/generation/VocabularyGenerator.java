package com.eainde.vocab.generation;

/**
 * Generative collaborator that proposes vocabulary for a topic.
 *
 * <p>Implementations return free text that is expected, but not guaranteed, to contain a JSON
 * object with an {@code items} array. Callers parse it leniently.</p>
 */
public interface VocabularyGenerator {

    String generate(GenerationPrompt prompt);
}
