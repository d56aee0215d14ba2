package com.linlay.reasoningrelay.stream.decoder;

import com.linlay.reasoningrelay.model.SemanticEvent;

import java.util.List;

/**
 * 内联推理标记状态机（{@code <think>...</think>}）。
 * <p>
 * 开标记与闭标记可以落在不同的块中。若开标记之后的闭标记出现在同一个块内，该块仍整体作为推理输出，
 * 随后立即产出 {@code (content, "")} 并退出推理区域，而不是继续等待后续块中的闭标记。
 * 每个流一个实例，流结束即丢弃。
 */
public class ThinkMarkerTracker {

    public static final String DEFAULT_OPEN_MARKER = "<think>";
    public static final String DEFAULT_CLOSE_MARKER = "</think>";

    private final String openMarker;
    private final String closeMarker;
    private boolean insideMarker;

    public ThinkMarkerTracker() {
        this(DEFAULT_OPEN_MARKER, DEFAULT_CLOSE_MARKER);
    }

    public ThinkMarkerTracker(String openMarker, String closeMarker) {
        if (openMarker == null || openMarker.isEmpty() || closeMarker == null || closeMarker.isEmpty()) {
            throw new IllegalArgumentException("markers must not be empty");
        }
        this.openMarker = openMarker;
        this.closeMarker = closeMarker;
    }

    public List<SemanticEvent> accept(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (!insideMarker) {
            int open = text.indexOf(openMarker);
            if (open < 0) {
                return List.of(SemanticEvent.content(text));
            }
            insideMarker = true;
            if (text.indexOf(closeMarker, open + openMarker.length()) < 0) {
                return List.of(SemanticEvent.reasoning(text));
            }
        } else if (!text.contains(closeMarker)) {
            return List.of(SemanticEvent.reasoning(text));
        }
        insideMarker = false;
        return List.of(SemanticEvent.reasoning(text), SemanticEvent.content(""));
    }

    public boolean insideMarker() {
        return insideMarker;
    }
}
