package com.ragpipe.chunking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.IntArrayList;

public class JtokkitTokenizer implements Tokenizer {
    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;

    public JtokkitTokenizer(String encodingName) {
        this.encoding = REGISTRY.getEncoding(encodingName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tokenizer encoding: " + encodingName));
    }

    @Override
    public int[] encode(String text) {
        if (text == null || text.isEmpty()) {
            return new int[0];
        }
        return encoding.encode(text).toArray();
    }

    @Override
    public String decode(int[] tokens) {
        IntArrayList list = new IntArrayList(tokens.length);
        for (int token : tokens) {
            list.add(token);
        }
        return encoding.decode(list);
    }

    @Override
    public String name() {
        return encoding.getName();
    }
}
