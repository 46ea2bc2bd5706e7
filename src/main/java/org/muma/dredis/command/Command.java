package org.muma.dredis.command;

import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.SimpleString;
import org.muma.dredis.store.Backend;

/**
 * 已解析、参数已校验的命令
 * 每个命令恰好对应一次后端调用，execute 是全函数：未命中返回 Null / 空数组，不抛异常。
 */
public interface Command {

    SimpleString RESP_OK = new SimpleString("OK");

    RespFrame execute(Backend backend);

    // 用于日志
    String name();
}
