package com.cadenza.targets.support;

import java.nio.charset.StandardCharsets;

/**
 * 目标语言字符串字面量转义工具
 */
public final class TargetStrings {

    private TargetStrings() {}

    /** 转义字符串内容（用于双引号包裹的字符串），C 系语言通用 */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    /** 双引号字面量 */
    public static String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }

    /** C# 插值字符串的文本段：额外转义花括号 */
    public static String escapeCSharpInterpolated(String s) {
        return escapeString(s).replace("{", "{{").replace("}", "}}");
    }

    /** JavaScript 模板字符串的文本段 */
    public static String escapeTemplateLiteral(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '`': sb.append("\\`"); break;
                case '$': sb.append("\\$"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** C++ 控制字符按八进制转义，"\0" 后紧跟数字时会被误读 */
    public static String escapeCpp(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    /** WAT 数据段字节转义：非可见 ASCII 一律 \hh，UTF-8 编码 */
    public static String escapeWat(String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            int v = b & 0xff;
            if (v >= 0x20 && v < 0x7f && v != '"' && v != '\\') {
                sb.append((char) v);
            } else {
                sb.append('\\').append(String.format("%02x", v));
            }
        }
        return sb.toString();
    }
}
