package com.linlay.reasoningrelay.stream.decoder;

@FunctionalInterface
public interface ChunkDecoderFactory {

    ChunkDecoder create(String model);
}
