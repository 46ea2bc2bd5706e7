package org.muma.dredis.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * RESP 解码异常
 * 继承 Netty 的 DecoderException，ByteToMessageDecoder 会原样抛给 pipeline，不会再包一层。
 */
public class RespDecodeException extends DecoderException {

    private final DecodeError error;

    public RespDecodeException(DecodeError error, String message) {
        super(message);
        this.error = error;
    }

    public RespDecodeException(DecodeError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public static RespDecodeException notComplete() {
        return new RespDecodeException(DecodeError.NOT_COMPLETE, "Frame is not complete");
    }

    public DecodeError error() {
        return error;
    }

    public boolean isNotComplete() {
        return error == DecodeError.NOT_COMPLETE;
    }
}
