package org.muma.dredis.command;

import org.muma.dredis.command.impl.generic.UnrecognizedCommand;
import org.muma.dredis.protocol.BulkString;
import org.muma.dredis.protocol.RespArray;
import org.muma.dredis.protocol.RespFrame;
import org.muma.dredis.protocol.SimpleError;
import org.muma.dredis.store.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 请求帧 -> 回复帧
 * <p>
 * 解析失败属于可恢复的请求级错误，回复 SimpleError 后连接继续；
 * 本类无可变状态，可被所有连接共享。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Backend backend;
    private final long slowLogMillis;

    public CommandDispatcher(Backend backend) {
        this(backend, 10);
    }

    public CommandDispatcher(Backend backend, long slowLogMillis) {
        this.backend = backend;
        this.slowLogMillis = slowLogMillis;
    }

    /**
     * 核心分发逻辑
     */
    public RespFrame dispatch(RespFrame request) {
        // 1. 解析命令
        Command command;
        try {
            command = CommandParser.parse(request);
        } catch (CommandException e) {
            log.warn("Invalid command {} ({}): {}", commandName(request), e.kind(), e.getMessage());
            return error("ERR " + e.getMessage());
        }

        if (command == UnrecognizedCommand.INSTANCE) {
            log.info("Unrecognized command '{}', replying OK", commandName(request));
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RespFrame response = command.execute(backend);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > slowLogMillis) {
                log.warn("Slow command detected: {} cost {}ms", command.name(), duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", command, duration);
            }
            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误，例如 ECHO 的文本无法表示为 SimpleString
            log.warn("Command execution failed (Client Error): {} - {}", command.name(), e.getMessage());
            return error("ERR " + e.getMessage());

        } catch (Exception e) {
            log.error("Internal Server Error processing command: {}", command.name(), e);
            return error("ERR internal server error");
        }
    }

    private static String commandName(RespFrame request) {
        if (request instanceof RespArray array && array.size() > 0 && array.get(0) instanceof BulkString name) {
            return name.asString();
        }
        return "<" + request.type() + ">";
    }

    // SimpleError 不能含 CR/LF，错误信息里可能带着客户端传来的原始字节
    private static SimpleError error(String message) {
        return new SimpleError(message.replace('\r', ' ').replace('\n', ' '));
    }
}
