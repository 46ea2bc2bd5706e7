package org.muma.dredis.command.impl.generic;

import org.muma.dredis.command.Command;
import org.muma.dredis.protocol.BulkString;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.RespNull;
import org.muma.dredis.store.Backend;

import java.util.List;

import static org.muma.dredis.command.CommandParser.extractArgs;
import static org.muma.dredis.command.CommandParser.stringArg;
import static org.muma.dredis.command.CommandParser.validateCommand;

// ECHO message，回复 SimpleString；含 CR/LF 的文本无法放进单行帧，改用 BulkString 原样返回
public record EchoCommand(String text) implements Command {

    public static final String NAME = "echo";

    public static EchoCommand parse(RespArray value) {
        validateCommand(value, List.of(NAME), 1);
        List<RespFrame> args = extractArgs(value, 1);
        return new EchoCommand(stringArg(args.get(0), "argument"));
    }

    @Override
    public RespFrame execute(Backend backend) {
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            return BulkString.of(text);
        }
        RespFrame reply = backend.echo(text);
        return reply == null ? RespNull.INSTANCE : reply;
    }

    @Override
    public String name() {
        return NAME;
    }
}
