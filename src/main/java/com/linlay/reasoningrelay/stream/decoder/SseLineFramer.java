package com.linlay.reasoningrelay.stream.decoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 把原始 event-stream 字节块切分为 {@code data:} 负载。
 * <p>
 * 完整的行随所在块立即释放；没有换行的尾部片段先暂存，与下一块拼接，避免被网络切开的 JSON 行或多字节
 * UTF-8 字符丢失。只有当暂存片段本身已是完整负载（{@code [DONE]} 或可解析的 JSON 对象）且下一块以
 * {@code data:} 开头时，才把片段单独作为一行处理。每个流一个实例，非线程安全。
 */
public class SseLineFramer {

    static final String DATA_PREFIX = "data:";
    static final String DONE_SENTINEL = "[DONE]";

    private static final byte[] EMPTY = new byte[0];
    private static final byte[] DATA_PREFIX_BYTES = DATA_PREFIX.getBytes(StandardCharsets.US_ASCII);
    private static final ObjectMapper PAYLOAD_MAPPER = new ObjectMapper();

    private byte[] pending = EMPTY;

    public List<String> feed(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return List.of();
        }
        List<String> payloads = new ArrayList<>();
        byte[] buffer = chunk;
        if (pending.length > 0) {
            if (startsDataLine(chunk) && isCompletePayload(pending)) {
                collectLine(new String(pending, StandardCharsets.UTF_8), payloads);
            } else {
                buffer = concat(pending, chunk);
            }
            pending = EMPTY;
        }

        int completeEnd = lastLineBreak(buffer) + 1;
        if (completeEnd > 0) {
            String text = new String(buffer, 0, completeEnd, StandardCharsets.UTF_8);
            for (String line : text.split("\\r?\\n|\\r")) {
                collectLine(line, payloads);
            }
        }
        if (completeEnd < buffer.length) {
            byte[] tail = Arrays.copyOfRange(buffer, completeEnd, buffer.length);
            if (isDoneLine(tail)) {
                collectLine(new String(tail, StandardCharsets.UTF_8), payloads);
            } else {
                pending = tail;
            }
        }
        return payloads;
    }

    /**
     * Releases a held fragment once the transport has ended.
     */
    public List<String> flush() {
        if (pending.length == 0) {
            return List.of();
        }
        List<String> payloads = new ArrayList<>(1);
        collectLine(new String(pending, StandardCharsets.UTF_8), payloads);
        pending = EMPTY;
        return payloads;
    }

    boolean hasPending() {
        return pending.length > 0;
    }

    private void collectLine(String line, List<String> payloads) {
        if (line == null || !line.startsWith(DATA_PREFIX)) {
            return;
        }
        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (!payload.isEmpty()) {
            payloads.add(payload);
        }
    }

    private boolean startsDataLine(byte[] chunk) {
        if (chunk.length < DATA_PREFIX_BYTES.length) {
            return false;
        }
        for (int i = 0; i < DATA_PREFIX_BYTES.length; i++) {
            if (chunk[i] != DATA_PREFIX_BYTES[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * A fragment cut inside a JSON string may itself be followed by text starting with {@code data:},
     * so only a payload that already stands on its own may end the line early.
     */
    private boolean isCompletePayload(byte[] fragment) {
        String line = new String(fragment, StandardCharsets.UTF_8);
        if (!line.startsWith(DATA_PREFIX)) {
            return false;
        }
        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (DONE_SENTINEL.equals(payload)) {
            return true;
        }
        if (!payload.startsWith("{") || !payload.endsWith("}")) {
            return false;
        }
        try {
            JsonNode node = PAYLOAD_MAPPER.readTree(payload);
            return node != null && node.isObject();
        } catch (JsonProcessingException ex) {
            return false;
        }
    }

    private boolean isDoneLine(byte[] tail) {
        String line = new String(tail, StandardCharsets.UTF_8);
        return line.startsWith(DATA_PREFIX) && DONE_SENTINEL.equals(line.substring(DATA_PREFIX.length()).trim());
    }

    private int lastLineBreak(byte[] buffer) {
        for (int i = buffer.length - 1; i >= 0; i--) {
            if (buffer[i] == '\n' || buffer[i] == '\r') {
                return i;
            }
        }
        return -1;
    }

    private byte[] concat(byte[] head, byte[] tail) {
        byte[] joined = Arrays.copyOf(head, head.length + tail.length);
        System.arraycopy(tail, 0, joined, head.length, tail.length);
        return joined;
    }
}
