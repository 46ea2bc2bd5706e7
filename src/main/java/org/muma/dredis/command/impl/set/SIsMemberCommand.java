package org.muma.dredis.command.impl.set;

import org.muma.dredis.command.Command;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.RespInteger;
import org.muma.dredis.store.Backend;

import java.util.List;

import static org.muma.dredis.command.CommandParser.extractArgs;
import static org.muma.dredis.command.CommandParser.stringArg;
import static org.muma.dredis.command.CommandParser.validateCommand;

/**
 * SISMEMBER key member
 * key 不存在也返回 0
 */
public record SIsMemberCommand(String key, RespFrame item) implements Command {

    public static final String NAME = "sismember";

    public static SIsMemberCommand parse(RespArray value) {
        validateCommand(value, List.of(NAME), 2);
        List<RespFrame> args = extractArgs(value, 1);
        return new SIsMemberCommand(stringArg(args.get(0), "key"), args.get(1));
    }

    @Override
    public RespFrame execute(Backend backend) {
        return RespInteger.of(backend.sismember(key, item));
    }

    @Override
    public String name() {
        return NAME;
    }
}
