package com.cadenza.targets.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 类路径上的运行时/清单模板，占位符写作 ${name}
 */
public final class Templates {
    private static final String BASE = "/com/cadenza/targets/runtime/";
    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private Templates() {}

    /**
     * 读取模板原文
     *
     * @throws IllegalStateException 模板不存在
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, Templates::read);
    }

    /**
     * 读取模板并替换占位符
     */
    public static String render(String name, Map<String, String> variables) {
        String text = load(name);
        for (Map.Entry<String, String> e : variables.entrySet()) {
            text = text.replace("${" + e.getKey() + "}", e.getValue());
        }
        return text;
    }

    private static String read(String name) {
        InputStream in = Templates.class.getResourceAsStream(BASE + name);
        if (in == null) {
            throw new IllegalStateException("Missing template: " + BASE + name);
        }
        try (InputStream stream = in) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] chunk = new byte[4096];
            int n;
            while ((n = stream.read(chunk)) != -1) {
                buffer.write(chunk, 0, n);
            }
            return new String(buffer.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template " + name, e);
        }
    }
}
