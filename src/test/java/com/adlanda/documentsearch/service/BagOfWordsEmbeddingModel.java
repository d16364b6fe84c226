package com.adlanda.documentsearch.service;

import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic embedding model for tests: one dimension per vocabulary word,
 * holding the number of times the word occurs. Text without vocabulary words
 * embeds to the zero vector.
 */
class BagOfWordsEmbeddingModel implements EmbeddingModel {

    private final List<String> vocabulary;

    BagOfWordsEmbeddingModel(List<String> vocabulary) {
        this.vocabulary = List.copyOf(vocabulary);
    }

    @Override
    public EmbeddingResponse call(EmbeddingRequest request) {
        List<Embedding> embeddings = new ArrayList<>();
        List<String> texts = request.getInstructions();
        for (int i = 0; i < texts.size(); i++) {
            embeddings.add(new Embedding(vectorize(texts.get(i)), i));
        }
        return new EmbeddingResponse(embeddings);
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        return texts.stream().map(this::vectorize).toList();
    }

    @Override
    public float[] embed(Document document) {
        return vectorize(document.getText());
    }

    @Override
    public int dimensions() {
        return vocabulary.size();
    }

    private float[] vectorize(String text) {
        float[] vector = new float[vocabulary.size()];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            int index = vocabulary.indexOf(token);
            if (index >= 0) {
                vector[index]++;
            }
        }
        return vector;
    }
}
