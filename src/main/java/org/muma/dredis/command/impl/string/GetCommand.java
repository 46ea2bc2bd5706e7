package org.muma.dredis.command.impl.string;

import org.muma.dredis.command.Command;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.RespNull;
import org.muma.dredis.store.Backend;

import java.util.List;

import static org.muma.dredis.command.CommandParser.extractArgs;
import static org.muma.dredis.command.CommandParser.stringArg;
import static org.muma.dredis.command.CommandParser.validateCommand;

// GET key
public record GetCommand(String key) implements Command {

    public static final String NAME = "get";

    public static GetCommand parse(RespArray value) {
        validateCommand(value, List.of(NAME), 1);
        List<RespFrame> args = extractArgs(value, 1);
        return new GetCommand(stringArg(args.get(0), "key"));
    }

    @Override
    public RespFrame execute(Backend backend) {
        RespFrame value = backend.get(key);
        return value == null ? RespNull.INSTANCE : value;
    }

    @Override
    public String name() {
        return NAME;
    }
}
