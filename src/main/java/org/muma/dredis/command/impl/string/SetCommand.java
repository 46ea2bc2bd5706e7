package org.muma.dredis.command.impl.string;

import org.muma.dredis.command.Command;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.store.Backend;

import java.util.List;

import static org.muma.dredis.command.CommandParser.extractArgs;
import static org.muma.dredis.command.CommandParser.stringArg;
import static org.muma.dredis.command.CommandParser.validateCommand;

/**
 * SET key value
 * value 原样保存 (任意帧)，后写覆盖先写
 */
public record SetCommand(String key, RespFrame value) implements Command {

    public static final String NAME = "set";

    public static SetCommand parse(RespArray value) {
        validateCommand(value, List.of(NAME), 2);
        List<RespFrame> args = extractArgs(value, 1);
        return new SetCommand(stringArg(args.get(0), "key"), args.get(1));
    }

    @Override
    public RespFrame execute(Backend backend) {
        backend.set(key, value);
        return RESP_OK;
    }

    @Override
    public String name() {
        return NAME;
    }
}
