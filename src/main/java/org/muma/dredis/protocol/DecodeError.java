package org.muma.dredis.protocol;

/**
 * 解码失败的种类
 * NOT_COMPLETE 不是协议错误，只表示缓冲区里的字节还不够一个完整帧。
 */
public enum DecodeError {
    NOT_COMPLETE,
    INVALID_FRAME_TYPE,
    INVALID_FRAME,
    INVALID_FRAME_LENGTH,
    PARSE_INT_ERROR,
    PARSE_FLOAT_ERROR,
    UTF8_ERROR
}
