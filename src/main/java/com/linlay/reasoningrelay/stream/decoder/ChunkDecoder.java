package com.linlay.reasoningrelay.stream.decoder;

import com.linlay.reasoningrelay.model.SemanticEvent;

import java.util.List;

/**
 * 将 provider 流式响应的原始字节块解码为语义事件。实例与单个流绑定，持有跨块状态。
 */
public interface ChunkDecoder {

    DecodedChunk decode(byte[] chunk);

    /**
     * Events still owed when the transport ends without sending the termination sentinel.
     */
    List<SemanticEvent> finish();
}
