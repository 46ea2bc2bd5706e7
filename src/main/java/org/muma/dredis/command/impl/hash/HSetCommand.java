package org.muma.dredis.command.impl.hash;

import org.muma.dredis.command.Command;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.store.Backend;

import java.util.List;

import static org.muma.dredis.command.CommandParser.extractArgs;
import static org.muma.dredis.command.CommandParser.stringArg;
import static org.muma.dredis.command.CommandParser.validateCommand;

/**
 * HSET key field value
 * 只支持单个 field，返回 OK (不是新增字段数)
 */
public record HSetCommand(String key, String field, RespFrame value) implements Command {

    public static final String NAME = "hset";

    public static HSetCommand parse(RespArray value) {
        validateCommand(value, List.of(NAME), 3);
        List<RespFrame> args = extractArgs(value, 1);
        return new HSetCommand(stringArg(args.get(0), "key"), stringArg(args.get(1), "field"), args.get(2));
    }

    @Override
    public RespFrame execute(Backend backend) {
        backend.hset(key, field, value);
        return RESP_OK;
    }

    @Override
    public String name() {
        return NAME;
    }
}
