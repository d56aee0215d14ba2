package com.linlay.reasoningrelay.stream.transport;

import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Flux;

/**
 * 流式传输能力：给定地址、请求头和请求体，返回惰性、可取消的原始字节块序列。
 * <p>
 * 订阅之前不发起任何请求；取消订阅即释放底层连接。连接、超时或非 2xx 响应以
 * {@link TransportException} 结束序列。
 */
public interface StreamTransport {

    Flux<byte[]> stream(String endpoint, HttpHeaders headers, Object body);
}
