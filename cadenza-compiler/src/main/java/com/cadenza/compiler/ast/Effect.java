package com.cadenza.compiler.ast;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;

/**
 * 副作用类别（封闭词汇表）
 */
public enum Effect {
    DATABASE("Database", true),
    NETWORK("Network", true),
    LOGGING("Logging", false),
    FILE_SYSTEM("FileSystem", false),
    MEMORY("Memory", false),
    IO("IO", false),
    DOM("DOM", false),
    LOCAL_STORAGE("LocalStorage", false),
    WEB_SOCKET("WebSocket", true),
    ANALYTICS("Analytics", false),
    PAYMENT("Payment", true);

    private final String displayName;
    private final boolean async;

    Effect(String displayName, boolean async) {
        this.displayName = displayName;
        this.async = async;
    }

    /** 源码中的写法，如 "FileSystem" */
    public String getDisplayName() {
        return displayName;
    }

    /** 该副作用在宿主上通常需要异步执行 */
    public boolean isAsync() {
        return async;
    }

    /**
     * 按源码名查找，大小写敏感
     *
     * @return 对应的副作用，未知名称返回 null
     */
    public static Effect fromName(String name) {
        for (Effect effect : values()) {
            if (effect.displayName.equals(name)) {
                return effect;
            }
        }
        return null;
    }

    public static Set<Effect> setOf(Effect... effects) {
        Set<Effect> set = EnumSet.noneOf(Effect.class);
        for (Effect e : effects) {
            set.add(e);
        }
        return set;
    }

    /** "Database, Logging" 形式的列表 */
    public static String join(Collection<Effect> effects) {
        StringBuilder sb = new StringBuilder();
        Iterator<Effect> it = effects.iterator();
        while (it.hasNext()) {
            sb.append(it.next().displayName);
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
