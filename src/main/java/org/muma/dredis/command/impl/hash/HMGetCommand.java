package org.muma.dredis.command.impl.hash;

import org.muma.dredis.command.Command;
import org.muma.dredis.command.CommandException;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.store.Backend;

import java.util.ArrayList;
import java.util.List;

import static org.muma.dredis.command.CommandParser.extractArgs;
import static org.muma.dredis.command.CommandParser.stringArg;
import static org.muma.dredis.command.CommandParser.validateCommand;

/**
 * HMGET key field [field ...]
 * <p>
 * 与标准 Redis 不同：不存在的 field 直接省略，不补 nil，结果数组可能比请求的 field 少。
 * key 不存在返回空数组。
 */
public record HMGetCommand(String key, List<String> fields) implements Command {

    public static final String NAME = "hmget";

    public HMGetCommand {
        fields = List.copyOf(fields);
    }

    public static HMGetCommand parse(RespArray value) {
        // 参数个数由数组长度决定：1 个 key + 至少 1 个 field
        int nArgs = value.size() - 1;
        if (nArgs < 2) {
            throw CommandException.invalidArgument("hmget command must have a key and at least 1 field");
        }
        validateCommand(value, List.of(NAME), nArgs);

        List<RespFrame> args = extractArgs(value, 1);
        String key = stringArg(args.get(0), "key");
        List<String> fields = new ArrayList<>(nArgs - 1);
        for (RespFrame arg : args.subList(1, args.size())) {
            fields.add(stringArg(arg, "field"));
        }
        return new HMGetCommand(key, fields);
    }

    @Override
    public RespFrame execute(Backend backend) {
        List<RespFrame> values = backend.hmget(key, fields);
        if (values == null) {
            return RespArray.EMPTY;
        }
        return new RespArray(values);
    }

    @Override
    public String name() {
        return NAME;
    }
}
