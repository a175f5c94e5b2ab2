package com.edge.aoi.core.parser;

/**
 * 单个检测日志解析失败
 */
public class LogParseException extends Exception {
    private final ParseErrorType type;
    private final String source;
    private final String section;
    private final String field;

    public LogParseException(ParseErrorType type, String section, String field, String message) {
        this(type, null, section, field, message, null);
    }

    public LogParseException(ParseErrorType type, String source, String section, String field,
                             String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.source = source;
        this.section = section;
        this.field = field;
    }

    /**
     * 补充来源文件，section 解释器本身不知道文件名
     */
    public LogParseException withSource(String source) {
        if (this.source != null) {
            return this;
        }
        LogParseException copy = new LogParseException(type, source, section, field, getMessage(), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public ParseErrorType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public String getSection() {
        return section;
    }

    public String getField() {
        return field;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LogParseException{type=").append(type);
        if (source != null) {
            sb.append(", source='").append(source).append('\'');
        }
        if (section != null) {
            sb.append(", section=").append(section);
        }
        if (field != null) {
            sb.append(", field=").append(field);
        }
        return sb.append(", message='").append(getMessage()).append("'}").toString();
    }
}
