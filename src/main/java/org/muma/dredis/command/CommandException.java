package org.muma.dredis.command;

/**
 * 命令解析错误 (元数不对、参数类型不对、非法 UTF-8 等)
 * 属于单个请求的可恢复错误：回复一个 SimpleError 即可，连接继续服务。
 */
public class CommandException extends RuntimeException {

    public enum Kind {
        INVALID_COMMAND,
        INVALID_ARGUMENT,
        UTF8_ERROR
    }

    private final Kind kind;

    public CommandException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CommandException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CommandException invalidCommand(String message) {
        return new CommandException(Kind.INVALID_COMMAND, message);
    }

    public static CommandException invalidArgument(String message) {
        return new CommandException(Kind.INVALID_ARGUMENT, message);
    }

    public Kind kind() {
        return kind;
    }
}
