package org.muma.dredis.command.impl.hash;

import org.muma.dredis.command.Command;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.RespNull;
import org.muma.dredis.store.Backend;

import java.util.List;

import static org.muma.dredis.command.CommandParser.extractArgs;
import static org.muma.dredis.command.CommandParser.stringArg;
import static org.muma.dredis.command.CommandParser.validateCommand;

// HGET key field
public record HGetCommand(String key, String field) implements Command {

    public static final String NAME = "hget";

    public static HGetCommand parse(RespArray value) {
        validateCommand(value, List.of(NAME), 2);
        List<RespFrame> args = extractArgs(value, 1);
        return new HGetCommand(stringArg(args.get(0), "key"), stringArg(args.get(1), "field"));
    }

    @Override
    public RespFrame execute(Backend backend) {
        RespFrame value = backend.hget(key, field);
        return value == null ? RespNull.INSTANCE : value;
    }

    @Override
    public String name() {
        return NAME;
    }
}
