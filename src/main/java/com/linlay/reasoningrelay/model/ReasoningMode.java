package com.linlay.reasoningrelay.model;

/**
 * 推理 provider 区分思考过程与最终内容的方式。
 */
public enum ReasoningMode {
    /**
     * Resolved from the model id: {@code deepseek-reasoner} streams a separate channel, anything else is
     * read for inline markers.
     */
    AUTO,
    NATIVE,
    INLINE_MARKER;

    private static final String NATIVE_REASONER_MODEL = "deepseek-reasoner";

    public ReasoningMode resolve(String model) {
        if (this != AUTO) {
            return this;
        }
        return model != null && NATIVE_REASONER_MODEL.equalsIgnoreCase(model.trim()) ? NATIVE : INLINE_MARKER;
    }
}
