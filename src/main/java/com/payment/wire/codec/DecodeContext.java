package com.payment.wire.codec;

/**
 * Where the decoder currently is in the JSON tree, plus the options of the call.
 * Immutable; descending into a field or list element returns a new context.
 */
public final class DecodeContext {

    private final String path;
    private final DecodeOptions options;

    private DecodeContext(String path, DecodeOptions options) {
        this.path = path;
        this.options = options;
    }

    public static DecodeContext root(String name, DecodeOptions options) {
        return new DecodeContext(name, options != null ? options : DecodeOptions.DEFAULT);
    }

    public DecodeContext field(String name) {
        return new DecodeContext(path + "." + name, options);
    }

    public DecodeContext index(int i) {
        return new DecodeContext(path + "[" + i + "]", options);
    }

    public String getPath() {
        return path;
    }

    public DecodeOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return path;
    }
}
