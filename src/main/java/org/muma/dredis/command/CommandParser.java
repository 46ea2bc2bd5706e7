package org.muma.dredis.command;

import org.muma.dredis.command.impl.generic.EchoCommand;
import org.muma.dredis.command.impl.generic.UnrecognizedCommand;
import org.muma.dredis.command.impl.hash.HGetAllCommand;
import org.muma.dredis.command.impl.hash.HGetCommand;
import org.muma.dredis.command.impl.hash.HMGetCommand;
import org.muma.dredis.command.impl.hash.HSetCommand;
import org.muma.dredis.command.impl.set.SAddCommand;
import org.muma.dredis.command.impl.set.SIsMemberCommand;
import org.muma.dredis.command.impl.string.GetCommand;
import org.muma.dredis.command.impl.string.SetCommand;
import org.muma.dredis.protocol.BulkString;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 帧 -> 命令
 * <p>
 * 只接受首元素为 BulkString 的 Array。命令名大小写不敏感，查静态注册表得到构造函数；
 * 不在表里的命令名返回 {@link UnrecognizedCommand}，不报错。
 */
public final class CommandParser {

    private static final Logger log = LoggerFactory.getLogger(CommandParser.class);

    // 命令名 (小写) -> 构造函数
    private static final Map<String, Function<RespArray, Command>> COMMANDS = Map.of(
            GetCommand.NAME, GetCommand::parse,
            SetCommand.NAME, SetCommand::parse,
            HGetCommand.NAME, HGetCommand::parse,
            HSetCommand.NAME, HSetCommand::parse,
            HGetAllCommand.NAME, HGetAllCommand::parse,
            HMGetCommand.NAME, HMGetCommand::parse,
            EchoCommand.NAME, EchoCommand::parse,
            SAddCommand.NAME, SAddCommand::parse,
            SIsMemberCommand.NAME, SIsMemberCommand::parse
    );

    private CommandParser() {
    }

    public static Command parse(RespFrame frame) {
        if (!(frame instanceof RespArray array) || array.isNull()) {
            throw CommandException.invalidCommand("Command must be an Array");
        }
        if (array.size() == 0 || !(array.get(0) instanceof BulkString name) || name.isNull()) {
            throw CommandException.invalidCommand("Command must have a BulkString as the first argument");
        }

        Function<RespArray, Command> factory = COMMANDS.get(lowerCase(name));
        if (factory == null) {
            log.debug("Unrecognized command: {}", name.asString());
            return UnrecognizedCommand.INSTANCE;
        }
        return factory.apply(array);
    }

    /**
     * 校验命令名和参数个数：数组长度必须等于 names.size() + nArgs
     */
    public static void validateCommand(RespArray value, List<String> names, int nArgs) {
        if (value.size() != nArgs + names.size()) {
            throw CommandException.invalidArgument(String.format("%s command must have exactly %d argument%s",
                    String.join(" ", names), nArgs, nArgs == 1 ? "" : "s"));
        }

        for (int i = 0; i < names.size(); i++) {
            if (!(value.get(i) instanceof BulkString cmd) || cmd.isNull()) {
                throw CommandException.invalidCommand("Command must have a BulkString as the first argument");
            }
            if (!lowerCase(cmd).equals(names.get(i))) {
                throw CommandException.invalidCommand("Invalid command: expected " + names.get(i) + ", got " + cmd.asString());
            }
        }
    }

    public static List<RespFrame> extractArgs(RespArray value, int start) {
        return value.elements().subList(start, value.size());
    }

    /**
     * 字符串参数必须是非空 BulkString，且是合法 UTF-8
     */
    public static String stringArg(RespFrame arg, String what) {
        if (!(arg instanceof BulkString bulk) || bulk.isNull()) {
            throw CommandException.invalidArgument("Invalid " + what);
        }
        try {
            return RespCodecUtil.decodeUtf8(bulk.content());
        } catch (CharacterCodingException e) {
            throw new CommandException(CommandException.Kind.UTF8_ERROR, "Invalid UTF-8 in " + what, e);
        }
    }

    // 命令名只比较 ASCII，ISO-8859-1 保证任意字节都能一一映射
    private static String lowerCase(BulkString name) {
        return new String(name.content(), StandardCharsets.ISO_8859_1).toLowerCase(Locale.ROOT);
    }
}
