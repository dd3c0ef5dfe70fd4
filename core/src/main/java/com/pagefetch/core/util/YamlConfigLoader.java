package com.pagefetch.core.util;

import com.pagefetch.core.http.Jitter;
import com.pagefetch.core.model.FetchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * fetch.yml을 읽어 FetchConfig로 변환. 없는 키는 기본값 유지, 모르는 키는 무시.
 *
 * 예상 YAML 키:
 * poolSize: 5
 * timeoutMs: 5000
 * followRedirects: true
 * shareSession: false
 * defaultHeaders:
 *   User-Agent: "Mozilla/5.0"
 * retry:
 *   maxAttempts: 12
 *   baseDelayMs: 10
 *   multiplier: 2.0
 *   jitter: FULL | PARTIAL | NONE
 *   maxDelayMs: 30000
 */
public final class YamlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(YamlConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "fetch.yml";

    private YamlConfigLoader() {}

    public static FetchConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("fetch.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 클래스패스 리소스에서 로드. 리소스가 없으면 defaults(). */
    public static FetchConfig loadResource(String name) throws IOException {
        Objects.requireNonNull(name, "name");
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = YamlConfigLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(name)) {
            if (in == null) {
                LOG.debug("No {} on classpath, using defaults", name);
                FetchConfig cfg = FetchConfig.defaults();
                cfg.validate();
                return cfg;
            }
            return load(in);
        }
    }

    public static FetchConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        FetchConfig cfg = FetchConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setInt(map, "poolSize", cfg::setPoolSize);
        setLong(map, "timeoutMs", ms -> { if (ms > 0) cfg.setTimeoutMs(ms); });
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setBoolean(map, "shareSession", cfg::setShareSession);

        // 2) defaultHeaders: 키가 있으면 통째로 교체 (빈 맵/null이면 기본 헤더 없음)
        if (map.containsKey("defaultHeaders")) {
            Object v = map.get("defaultHeaders");
            Map<String, String> headers = new LinkedHashMap<>();
            if (v instanceof Map<?, ?> hm) {
                hm.forEach((k, val) -> {
                    if (k != null && val != null) headers.put(String.valueOf(k), String.valueOf(val));
                });
            }
            cfg.setDefaultHeaders(headers);
        }

        // 3) retry.*
        Object r = map.get("retry");
        if (r instanceof Map<?, ?> retry) {
            FetchConfig.RetryCfg rc = cfg.getRetry();
            setInt(retry, "maxAttempts", rc::setMaxAttempts);
            setLong(retry, "baseDelayMs", rc::setBaseDelayMs);
            setDouble(retry, "multiplier", rc::setMultiplier);
            setEnum(retry, "jitter", Jitter.class, rc::setJitter);
            setLong(retry, "maxDelayMs", rc::setMaxDelayMs);
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().toUpperCase(Locale.ROOT);
        try {
            setter.accept(Enum.valueOf(type, s));
        } catch (IllegalArgumentException unknown) {
            // 사용자 오타 시 기본값 유지
            LOG.warn("Unknown {} value '{}' for key '{}', keeping default", type.getSimpleName(), v, key);
        }
    }
}
