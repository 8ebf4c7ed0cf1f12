package cn.hjw.dev.flowscript.parse;

import cn.hjw.dev.flowscript.model.ToolType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * 原始类型串 -> ToolType 查找表
 * 表内容来自 classpath 资源, 加载后只读
 */
@Slf4j
public final class ToolTypeRegistry {

    private final Map<String, ToolType> table;

    private ToolTypeRegistry(Map<String, ToolType> table) {
        this.table = Collections.unmodifiableMap(table);
    }

    public static ToolTypeRegistry load(String resource) {
        ClassLoader loader = ToolTypeRegistry.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Tool type table not found on classpath: " + resource);
            }
            Properties props = new Properties();
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            Map<String, ToolType> table = new HashMap<>();
            for (String key : props.stringPropertyNames()) {
                String typeName = props.getProperty(key).trim();
                try {
                    table.put(normalize(key), ToolType.valueOf(typeName));
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException("Unknown tool type '" + typeName + "' for key '" + key
                            + "' in " + resource, e);
                }
            }
            log.debug("Loaded {} tool type mappings from {}", table.size(), resource);
            return new ToolTypeRegistry(table);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read tool type table " + resource, e);
        }
    }

    public Optional<ToolType> lookup(String rawType) {
        if (rawType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(normalize(rawType)));
    }

    public int size() {
        return table.size();
    }

    private static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
