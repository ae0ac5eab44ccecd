package dev.scriptorium.fixture;

import dev.scriptorium.search.SearchCandidate;

import java.util.Map;

/**
 * Test builder for {@link SearchCandidate}. The default text has between 10 and 500 words so no
 * length factor applies.
 */
public final class SearchCandidateBuilder {

    public static final String NEUTRAL_TEXT =
            "This passage explains how documents are split into segments before they are embedded.";

    private String chunkId = "doc_0000";
    private String text = NEUTRAL_TEXT;
    private double score = 0.8;
    private String sourceFile = "/docs/doc.txt";
    private int position = 0;

    public SearchCandidateBuilder chunkId(String chunkId) {
        this.chunkId = chunkId;
        return this;
    }

    public SearchCandidateBuilder text(String text) {
        this.text = text;
        return this;
    }

    public SearchCandidateBuilder score(double score) {
        this.score = score;
        return this;
    }

    public SearchCandidateBuilder sourceFile(String sourceFile) {
        this.sourceFile = sourceFile;
        return this;
    }

    public SearchCandidateBuilder position(int position) {
        this.position = position;
        return this;
    }

    public SearchCandidate build() {
        return new SearchCandidate(chunkId, text, score, sourceFile, Map.of("source_file", sourceFile), position);
    }
}
