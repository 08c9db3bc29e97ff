package com.ragpipe.embedding;

import java.util.List;

public interface EmbeddingService {
    /**
     * Returns one vector per input, in input order.
     *
     * @throws EmbeddingException when the collaborator is unreachable after retries or answers
     *         with a malformed payload
     */
    List<float[]> embed(List<EmbeddingInput> inputs);

    default float[] embedQuery(String text) {
        return embed(List.of(EmbeddingInput.text(text))).get(0);
    }

    default String version() {
        return "unversioned";
    }
}
