package org.muma.dredis.command.impl.generic;

import org.muma.dredis.command.Command;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.store.Backend;

/**
 * 未知命令：容忍而不是拒绝，不访问后端，固定回复 OK
 */
public final class UnrecognizedCommand implements Command {

    public static final UnrecognizedCommand INSTANCE = new UnrecognizedCommand();

    private UnrecognizedCommand() {
    }

    @Override
    public RespFrame execute(Backend backend) {
        return RESP_OK;
    }

    @Override
    public String name() {
        return "unrecognized";
    }

    @Override
    public String toString() {
        return "UnrecognizedCommand";
    }
}
