package com.linlay.reasoningrelay.stream.decoder;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SseLineFramerTest {

    private final SseLineFramer framer = new SseLineFramer();

    @Test
    void shouldReleaseEveryCompleteDataLineInOneChunk() {
        List<String> payloads = framer.feed(bytes("data: {\"a\":1}\n\ndata: {\"b\":2}\n\n"));

        assertThat(payloads).containsExactly("{\"a\":1}", "{\"b\":2}");
        assertThat(framer.hasPending()).isFalse();
    }

    @Test
    void shouldJoinJsonLineSplitAcrossChunks() {
        assertThat(framer.feed(bytes("data: {\"choices\":[{\"de"))).isEmpty();
        assertThat(framer.hasPending()).isTrue();

        List<String> payloads = framer.feed(bytes("lta\":{}}]}\n\n"));

        assertThat(payloads).containsExactly("{\"choices\":[{\"delta\":{}}]}");
        assertThat(framer.hasPending()).isFalse();
    }

    @Test
    void shouldKeepMultiByteCharacterSplitByTheNetwork() {
        byte[] line = bytes("data: {\"content\":\"思考\"}\n");
        int splitInsideCharacter = "data: {\"content\":\"".getBytes(StandardCharsets.UTF_8).length + 1;

        List<String> payloads = new ArrayList<>(framer.feed(Arrays.copyOfRange(line, 0, splitInsideCharacter)));
        payloads.addAll(framer.feed(Arrays.copyOfRange(line, splitInsideCharacter, line.length)));

        assertThat(payloads).containsExactly("{\"content\":\"思考\"}");
    }

    @Test
    void shouldTakeHeldFragmentAsOwnLineWhenNextChunkStartsNewDataLine() {
        assertThat(framer.feed(bytes("data: {\"a\":1}"))).isEmpty();

        List<String> payloads = framer.feed(bytes("data: {\"b\":2}\n"));

        assertThat(payloads).containsExactly("{\"a\":1}", "{\"b\":2}");
    }

    @Test
    void shouldJoinFragmentWhenNextChunkStartsWithDataTextInsideJsonString() {
        assertThat(framer.feed(bytes("data: {\"choices\":[{\"delta\":{\"content\":\"prefix "))).isEmpty();

        List<String> payloads = framer.feed(bytes("data: field\"}}]}\n\n"));

        assertThat(payloads).containsExactly("{\"choices\":[{\"delta\":{\"content\":\"prefix data: field\"}}]}");
    }

    @Test
    void incompleteJsonFragmentShouldWaitForTheRestOfItsLine() {
        framer.feed(bytes("data: {\"a\":1}\n"));

        assertThat(framer.feed(bytes("data: {\"b\":"))).isEmpty();
        assertThat(framer.feed(bytes("2}\n"))).containsExactly("{\"b\":2}");
    }

    @Test
    void shouldReleaseDoneSentinelWithoutTrailingLineBreak() {
        List<String> payloads = framer.feed(bytes("data: {\"a\":1}\ndata: [DONE]"));

        assertThat(payloads).containsExactly("{\"a\":1}", "[DONE]");
        assertThat(framer.hasPending()).isFalse();
    }

    @Test
    void shouldIgnoreCommentsEventNamesAndEmptyPayloads() {
        List<String> payloads = framer.feed(bytes(": keep-alive\r\nevent: message\r\ndata:\r\ndata: x\r\n\r\n"));

        assertThat(payloads).containsExactly("x");
    }

    @Test
    void flushShouldReleaseHeldFragmentOnce() {
        framer.feed(bytes("data: {\"tail\":true}"));

        assertThat(framer.flush()).containsExactly("{\"tail\":true}");
        assertThat(framer.flush()).isEmpty();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
