package org.csu.kpiformula.cli;

import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 代表一个命令行会话，保存用户设置的变量绑定。
 */
public class ShellSession {

    private final Map<String, Double> bindings = new LinkedHashMap<>();

    @Getter
    @Setter
    private boolean running = true;

    @Getter
    private int commandCount = 0;

    public void bind(String name, double value) {
        bindings.put(name, value);
    }

    public boolean unbind(String name) {
        return bindings.remove(name) != null;
    }

    public void clear() {
        bindings.clear();
    }

    /**
     * 只读视图；公式引擎不会修改它。
     */
    public Map<String, Double> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    void countCommand() {
        commandCount++;
    }
}
