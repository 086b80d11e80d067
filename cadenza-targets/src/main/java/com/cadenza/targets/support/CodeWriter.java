package com.cadenza.targets.support;

/**
 * 生成代码的输出缓冲区，跟踪缩进层级
 */
public class CodeWriter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private final boolean braceOnNewLine;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public CodeWriter(String indentUnit) {
        this(indentUnit, false);
    }

    /**
     * @param braceOnNewLine 左花括号单独成行（C# 风格）
     */
    public CodeWriter(String indentUnit, boolean braceOnNewLine) {
        this.indentUnit = indentUnit;
        this.braceOnNewLine = braceOnNewLine;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 追加一整行
     */
    public void line(String text) {
        append(text);
        newLine();
    }

    /**
     * 追加多行文本，每行按当前缩进对齐
     */
    public void lines(String text) {
        for (String l : text.split("\n", -1)) {
            if (l.isEmpty()) {
                newLine();
            } else {
                line(l);
            }
        }
    }

    /**
     * 输出 "header {" 并增加缩进
     */
    public void openBlock(String header) {
        if (header.isEmpty()) {
            line("{");
        } else if (braceOnNewLine) {
            line(header);
            line("{");
        } else {
            line(header + " {");
        }
        indent();
    }

    /**
     * 结束当前块并接续下一块，如 "} else {"
     */
    public void continueBlock(String header) {
        dedent();
        if (braceOnNewLine) {
            line("}");
            openBlock(header);
        } else {
            line("} " + header + " {");
            indent();
        }
    }

    /**
     * 减少缩进并输出结束符，如 "}"、"} else {"
     */
    public void closeBlock(String closer) {
        dedent();
        line(closer);
    }

    /**
     * 追加空行（两个换行）
     */
    public void blankLine() {
        // 避免连续多个空行
        int len = output.length();
        if (len == 0 || (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n')) {
            return;
        }
        if (output.charAt(len - 1) != '\n') {
            output.append("\n");
        }
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }
}
