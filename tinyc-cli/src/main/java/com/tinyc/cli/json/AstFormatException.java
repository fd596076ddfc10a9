package com.tinyc.cli.json;

/**
 * JSON AST 格式错误
 */
public class AstFormatException extends RuntimeException {

    private final String path;

    public AstFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public AstFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /** 出错节点在 JSON 中的路径，如 {@code $.statements[0].body} */
    public String getPath() {
        return path;
    }
}
