package com.example.hipagent.model;

public record RetrievalQuery(
        String question,
        Integer topK,
        Integer maxChars
) {
    public int resolveTopK(int defaultValue) {
        return topK == null || topK <= 0 ? defaultValue : topK;
    }

    public int resolveMaxChars(int defaultValue) {
        return maxChars == null ? defaultValue : maxChars;
    }
}
