package org.muma.dredis.command.impl.hash;

import org.muma.dredis.command.Command;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.RespMap;
import org.muma.dredis.store.Backend;

import java.util.List;
import java.util.Map;

import static org.muma.dredis.command.CommandParser.extractArgs;
import static org.muma.dredis.command.CommandParser.stringArg;
import static org.muma.dredis.command.CommandParser.validateCommand;

/**
 * HGETALL key
 * 命中返回 RESP3 Map (field 有序)，key 不存在返回空数组
 */
public record HGetAllCommand(String key) implements Command {

    public static final String NAME = "hgetall";

    public static HGetAllCommand parse(RespArray value) {
        validateCommand(value, List.of(NAME), 1);
        List<RespFrame> args = extractArgs(value, 1);
        return new HGetAllCommand(stringArg(args.get(0), "key"));
    }

    @Override
    public RespFrame execute(Backend backend) {
        Map<String, RespFrame> fields = backend.hgetall(key);
        if (fields == null) {
            return RespArray.EMPTY;
        }
        return RespMap.of(fields);
    }

    @Override
    public String name() {
        return NAME;
    }
}
